package com.talentscope.search.synonym;

public record SynonymPair(String canonical, String variant) {
}
