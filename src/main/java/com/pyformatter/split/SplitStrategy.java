package com.pyformatter.split;

import java.util.List;
import java.util.Set;

import com.pyformatter.api.Feature;
import com.pyformatter.lines.Line;

/**
 * One way of breaking a line into several shorter ones.
 */
public interface SplitStrategy {

    /**
     * Splits {@code line}. The returned lines may still be too long; the caller transforms them
     * again.
     *
     * @throws CannotSplitException when this strategy does not apply to the line
     */
    List<Line> split(Line line, Set<Feature> features) throws CannotSplitException;

    String getName();
}
