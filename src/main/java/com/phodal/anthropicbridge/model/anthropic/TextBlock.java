package com.phodal.anthropicbridge.model.anthropic;

public record TextBlock(String text) implements ContentBlock {
}
