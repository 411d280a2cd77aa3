package com.talentscope.search.security;

public record CallerIdentity(String userId) {
}
