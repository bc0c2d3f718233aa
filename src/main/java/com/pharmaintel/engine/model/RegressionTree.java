package com.pharmaintel.engine.model;

import java.util.Arrays;
import java.util.Comparator;

final class RegressionTree {

    private static final double EPS = 1e-12;

    private final Node root;

    private RegressionTree(Node root) {
        this.root = root;
    }

    static RegressionTree fit(double[][] x, double[] y, int[] sample, int maxDepth, int minLeaf) {
        return new RegressionTree(build(x, y, sample, 0, maxDepth, Math.max(1, minLeaf)));
    }

    double predict(double[] features) {
        Node node = root;
        while (!node.leaf) {
            node = features[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    private static Node build(double[][] x, double[] y, int[] idx, int depth, int maxDepth, int minLeaf) {
        double sum = 0.0;
        double sumSq = 0.0;
        for (int i : idx) {
            sum += y[i];
            sumSq += y[i] * y[i];
        }
        double mean = sum / idx.length;
        double sse = sumSq - sum * sum / idx.length;
        if (depth >= maxDepth || idx.length < 2 * minLeaf || sse <= EPS) {
            return Node.leaf(mean);
        }

        int bestFeature = -1;
        double bestThreshold = 0.0;
        double bestSse = sse;
        int features = x[idx[0]].length;

        for (int f = 0; f < features; f++) {
            final int feature = f;
            Integer[] sorted = Arrays.stream(idx).boxed().toArray(Integer[]::new);
            Arrays.sort(sorted, Comparator.comparingDouble(i -> x[i][feature]));

            double leftSum = 0.0;
            double leftSq = 0.0;
            for (int s = 1; s < sorted.length; s++) {
                double v = y[sorted[s - 1]];
                leftSum += v;
                leftSq += v * v;
                double lo = x[sorted[s - 1]][feature];
                double hi = x[sorted[s]][feature];
                if (s < minLeaf || sorted.length - s < minLeaf || lo >= hi) {
                    continue;
                }
                double rightSum = sum - leftSum;
                double rightSq = sumSq - leftSq;
                int rightCount = sorted.length - s;
                double candidate = (leftSq - leftSum * leftSum / s) + (rightSq - rightSum * rightSum / rightCount);
                if (candidate < bestSse - EPS) {
                    bestSse = candidate;
                    bestFeature = feature;
                    bestThreshold = (lo + hi) / 2.0;
                }
            }
        }

        if (bestFeature < 0) {
            return Node.leaf(mean);
        }
        final int splitFeature = bestFeature;
        final double threshold = bestThreshold;
        int[] left = Arrays.stream(idx).filter(i -> x[i][splitFeature] <= threshold).toArray();
        int[] right = Arrays.stream(idx).filter(i -> x[i][splitFeature] > threshold).toArray();
        return Node.split(splitFeature, threshold,
            build(x, y, left, depth + 1, maxDepth, minLeaf),
            build(x, y, right, depth + 1, maxDepth, minLeaf));
    }

    private static final class Node {
        private final boolean leaf;
        private final double value;
        private final int feature;
        private final double threshold;
        private final Node left;
        private final Node right;

        private Node(boolean leaf, double value, int feature, double threshold, Node left, Node right) {
            this.leaf = leaf;
            this.value = value;
            this.feature = feature;
            this.threshold = threshold;
            this.left = left;
            this.right = right;
        }

        private static Node leaf(double value) {
            return new Node(true, value, -1, 0.0, null, null);
        }

        private static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(false, 0.0, feature, threshold, left, right);
        }
    }
}
