package com.nrqlbridge.service.core.frame;

import com.nrqlbridge.service.core.result.ResultShape;
import java.util.List;
import java.util.Optional;

/** Frames produced for one result set, in emission order (table frame first). */
public record FrameSet(ResultShape shape, List<Frame> frames) {

    public FrameSet {
        frames = List.copyOf(frames);
        if (frames.size() > 2) {
            throw new IllegalArgumentException("A frame set holds at most two frames, got " + frames.size());
        }
    }

    public static FrameSet empty() {
        return new FrameSet(ResultShape.EMPTY, List.of());
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int size() {
        return frames.size();
    }

    public Optional<Frame> first(VisualizationHint hint) {
        return frames.stream().filter(f -> f.visualizationHint() == hint).findFirst();
    }
}
