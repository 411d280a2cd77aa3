package com.talentscope.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchedChunk {
    private String chunkType;
    private String content;
    private Double score;

    public MatchedChunk() {
    }

    public MatchedChunk(String chunkType, String content, Double score) {
        this.chunkType = chunkType;
        this.content = content;
        this.score = score;
    }

    public String getChunkType() {
        return chunkType;
    }

    public void setChunkType(String chunkType) {
        this.chunkType = chunkType;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }
}
