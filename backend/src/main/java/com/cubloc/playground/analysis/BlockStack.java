package com.cubloc.playground.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Open blocks of one validation pass, innermost last.
 */
public final class BlockStack {

    private final List<BlockFrame> frames = new ArrayList<>();

    public BlockFrame push(BlockKind kind, int line, Token opener) {
        BlockFrame frame = new BlockFrame(kind, line, opener);
        frames.add(frame);
        return frame;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int size() {
        return frames.size();
    }

    public BlockFrame pop() {
        return frames.remove(frames.size() - 1);
    }

    public int findOpen(BlockKind kind) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).kind() == kind) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasOpen(BlockKind kind) {
        return findOpen(kind) != -1;
    }

    /**
     * Frames stacked above {@code depth}, innermost first.
     */
    public List<BlockFrame> above(int depth) {
        List<BlockFrame> result = new ArrayList<>();
        for (int i = frames.size() - 1; i > depth; i--) {
            result.add(frames.get(i));
        }
        return result;
    }

    /**
     * Discards the frame at {@code depth} and every frame above it, returning the discarded frame.
     */
    public BlockFrame truncate(int depth) {
        BlockFrame matched = frames.get(depth);
        frames.subList(depth, frames.size()).clear();
        return matched;
    }

    public List<BlockFrame> frames() {
        return List.copyOf(frames);
    }
}
