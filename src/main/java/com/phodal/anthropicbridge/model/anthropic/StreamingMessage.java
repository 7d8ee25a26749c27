package com.phodal.anthropicbridge.model.anthropic;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * In-progress message owned by a single stream. Content only grows; stop reason and usage are set once,
 * when the stream finishes. Callers only ever see immutable {@link Message} snapshots.
 */
@Getter
public class StreamingMessage {

    private String id = "";

    private String role = "assistant";

    private String model = "";

    private StopReason stopReason;

    private Usage usage;

    private final List<BlockBuffer> blocks = new ArrayList<>();

    public void start(String id, String role, String model) {
        this.id = id;
        this.role = role;
        this.model = model;
    }

    /**
     * Appends an empty text block and returns its index
     */
    public int openTextBlock() {
        blocks.add(BlockBuffer.text());
        return blocks.size() - 1;
    }

    /**
     * Appends a tool-use block with an empty input and returns its index
     */
    public int openToolUseBlock(String id, String name) {
        blocks.add(BlockBuffer.toolUse(id, name));
        return blocks.size() - 1;
    }

    public int blockCount() {
        return blocks.size();
    }

    public void appendText(int index, String text) {
        blocks.get(index).text.append(text);
    }

    /**
     * Appends a fragment of JSON arguments to a tool-use block and returns the accumulated text
     */
    public String appendArguments(int index, String fragment) {
        BlockBuffer block = blocks.get(index);
        block.arguments.append(fragment);
        return block.arguments.toString();
    }

    public void updateInput(int index, Map<String, Object> input) {
        blocks.get(index).input = input;
    }

    public ContentBlock blockAt(int index) {
        return blocks.get(index).toContentBlock();
    }

    public void finish(StopReason stopReason, Usage usage) {
        if (this.stopReason != null) {
            throw new IllegalStateException("Message " + id + " already finished");
        }
        this.stopReason = stopReason;
        if (usage != null) {
            this.usage = usage;
        }
    }

    public List<ContentBlock> getContent() {
        List<ContentBlock> content = new ArrayList<>(blocks.size());
        for (BlockBuffer block : blocks) {
            content.add(block.toContentBlock());
        }
        return Collections.unmodifiableList(content);
    }

    public Message snapshot() {
        return Message.builder()
                .id(id)
                .role(role)
                .model(model)
                .content(getContent())
                .stopReason(stopReason)
                .usage(usage != null ? usage : Usage.ZERO)
                .build();
    }

    private static final class BlockBuffer {
        private final boolean tool;
        private final String id;
        private final String name;
        private final StringBuilder text = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();
        private Map<String, Object> input = Map.of();

        private BlockBuffer(boolean tool, String id, String name) {
            this.tool = tool;
            this.id = id;
            this.name = name;
        }

        static BlockBuffer text() {
            return new BlockBuffer(false, null, null);
        }

        static BlockBuffer toolUse(String id, String name) {
            return new BlockBuffer(true, id, name);
        }

        ContentBlock toContentBlock() {
            return tool ? new ToolUseBlock(id, name, input) : new TextBlock(text.toString());
        }
    }
}
