package com.talentscope.search.embed;

public enum EmbeddingMode {
    HTTP,
    LOCAL
}
