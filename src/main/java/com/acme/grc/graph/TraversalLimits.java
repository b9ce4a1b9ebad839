package com.acme.grc.graph;

import com.acme.grc.config.GrcSettings;

/**
 * Safety bounds for a traversal.
 *
 * @param maxDepth    maximum number of link hops from the start node
 * @param maxNodes    maximum number of control configs visited, start included
 * @param parallelism worker threads reading one frontier level; 1 reads sequentially
 */
public record TraversalLimits(int maxDepth, int maxNodes, int parallelism) {
    public TraversalLimits {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxNodes < 1) throw new IllegalArgumentException("maxNodes must be >= 1");
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1");
    }

    public static TraversalLimits from(GrcSettings.Traversal t) {
        return new TraversalLimits(t.maxDepth, t.maxNodes, t.parallelism);
    }

    public static TraversalLimits defaults() {
        return from(new GrcSettings.Traversal());
    }
}
