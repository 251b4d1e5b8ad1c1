/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.hierarchicalforecast.hierarchy;

import static com.amazon.hierarchicalforecast.CommonUtils.checkArgument;
import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

import lombok.Getter;

import com.amazon.hierarchicalforecast.errors.InvalidStructureException;
import com.amazon.hierarchicalforecast.errors.OutOfRangeException;

/**
 * A fixed tree of series together with the observed bottom-level data. Every
 * aggregate node is the sum of its children at every period; the aggregates
 * are derived from the bottom series through the summing matrix and are never
 * set directly.
 * <p>
 * Nodes are stored breadth first in a single array: the total (if any) first,
 * then each level in order, the leaves last and in the order of the bottom
 * series. A hierarchy is immutable; {@link #window(int, int)} returns a new
 * hierarchy that shares the node array and the summing matrix.
 */
public class Hierarchy {

    public static final String ROOT_LABEL = "Total";

    private final HierarchyNode[] nodes;

    private final int[][] levelMembers;

    @Getter
    private final AggregationMatrix summingMatrix;

    @Getter
    private final GroupingSpec groupingSpec;

    @Getter
    private final TimeIndex timeIndex;

    // bottom series x time
    private final double[][] bottomSeries;

    // node x time
    private final double[][] aggregated;

    private Hierarchy(HierarchyNode[] nodes, int[][] levelMembers, AggregationMatrix summingMatrix,
            GroupingSpec groupingSpec, TimeIndex timeIndex, double[][] bottomSeries) {
        this.nodes = nodes;
        this.levelMembers = levelMembers;
        this.summingMatrix = summingMatrix;
        this.groupingSpec = groupingSpec;
        this.timeIndex = timeIndex;
        this.bottomSeries = bottomSeries;
        this.aggregated = summingMatrix.multiply(bottomSeries);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a hierarchy over a rectangular table of observations.
     *
     * @param observations time x bottom series
     * @param groupingSpec shape of the tree above the bottom series
     * @return the hierarchy
     * @throws InvalidStructureException if the grouping does not partition the
     *                                   columns of the table
     */
    public static Hierarchy build(double[][] observations, GroupingSpec groupingSpec) {
        return builder().observations(observations).groupingSpec(groupingSpec).build();
    }

    /**
     * @return all node series, node x time; a fresh copy on every call
     */
    public double[][] aggregate() {
        double[][] copy = new double[aggregated.length][];
        for (int i = 0; i < aggregated.length; i++) {
            copy[i] = Arrays.copyOf(aggregated[i], aggregated[i].length);
        }
        return copy;
    }

    /**
     * Restricts the hierarchy to the periods {@code start} to {@code end}, both
     * inclusive and counted from the first period of this hierarchy.
     *
     * @param start first period kept
     * @param end   last period kept
     * @return a new hierarchy over the sub-period with the same structure
     * @throws OutOfRangeException if {@code end} precedes {@code start} or the
     *                             range exceeds the available data
     */
    public Hierarchy window(int start, int end) {
        if (start < 0 || end < start || end >= length()) {
            throw new OutOfRangeException(
                    "window [" + start + ", " + end + "] is outside of the " + length() + " available periods");
        }
        double[][] slice = new double[bottomSeries.length][];
        for (int j = 0; j < bottomSeries.length; j++) {
            slice[j] = Arrays.copyOfRange(bottomSeries[j], start, end + 1);
        }
        return new Hierarchy(nodes, levelMembers, summingMatrix, groupingSpec, timeIndex.shift(start), slice);
    }

    public int nodeCount() {
        return nodes.length;
    }

    public int bottomCount() {
        return bottomSeries.length;
    }

    /**
     * @return number of periods
     */
    public int length() {
        return bottomSeries[0].length;
    }

    /**
     * @return number of node levels, 0 being the total
     */
    public int getDepth() {
        return levelMembers.length;
    }

    public int levelOf(int node) {
        return getNode(node).getLevel();
    }

    public int levelOf(HierarchyNode node) {
        checkNotNull(node, "node must not be null");
        return levelOf(node.getIndex());
    }

    public HierarchyNode getNode(int node) {
        checkArgument(node >= 0 && node < nodes.length, "incorrect node index " + node);
        return nodes[node];
    }

    public List<HierarchyNode> getNodes() {
        return Collections.unmodifiableList(Arrays.asList(nodes));
    }

    /**
     * @param level a depth of the tree
     * @return indexes of the nodes at that depth, in order
     */
    public int[] nodesAtLevel(int level) {
        checkArgument(level >= 0 && level < levelMembers.length, "incorrect level " + level);
        return Arrays.copyOf(levelMembers[level], levelMembers[level].length);
    }

    /**
     * @return indexes of the leaf nodes, in the order of the bottom series
     */
    public int[] leaves() {
        return nodesAtLevel(levelMembers.length - 1);
    }

    /**
     * @return the single node without a parent, if there is exactly one
     */
    public OptionalInt getRoot() {
        return (levelMembers[0].length == 1) ? OptionalInt.of(levelMembers[0][0]) : OptionalInt.empty();
    }

    /**
     * @param label a node label
     * @return the index of the node with that label, or -1
     */
    public int indexOf(String label) {
        for (HierarchyNode node : nodes) {
            if (node.getLabel().equals(label)) {
                return node.getIndex();
            }
        }
        return -1;
    }

    /**
     * @param node a node index
     * @return the series of that node, a copy
     */
    public double[] getSeries(int node) {
        checkArgument(node >= 0 && node < nodes.length, "incorrect node index " + node);
        return Arrays.copyOf(aggregated[node], aggregated[node].length);
    }

    public double getValue(int node, int t) {
        return aggregated[node][t];
    }

    public String[] getLabels() {
        return Arrays.stream(nodes).map(HierarchyNode::getLabel).toArray(String[]::new);
    }

    /**
     * @return the level of every node, indexed by node
     */
    public int[] getNodeLevels() {
        return Arrays.stream(nodes).mapToInt(HierarchyNode::getLevel).toArray();
    }

    /**
     * @param other another hierarchy
     * @return true if both hierarchies have the same tree
     */
    public boolean hasSameStructure(Hierarchy other) {
        return other != null && summingMatrix.equals(other.summingMatrix)
                && Arrays.equals(getNodeLevels(), other.getNodeLevels());
    }

    public static class Builder {

        private double[][] observations;
        private GroupingSpec groupingSpec = GroupingSpec.ungrouped();
        private String[] bottomLabels;
        private int frequency = 1;
        private int startYear = 1;
        private int startCycle = 1;

        Builder() {
        }

        /**
         * @param observations time x bottom series, as read from a rectangular table
         * @return this builder
         */
        public Builder observations(double[][] observations) {
            this.observations = observations;
            return this;
        }

        public Builder groupingSpec(GroupingSpec groupingSpec) {
            this.groupingSpec = groupingSpec;
            return this;
        }

        public Builder bottomLabels(String... bottomLabels) {
            this.bottomLabels = bottomLabels;
            return this;
        }

        public Builder frequency(int frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder startYear(int startYear) {
            this.startYear = startYear;
            return this;
        }

        public Builder startCycle(int startCycle) {
            this.startCycle = startCycle;
            return this;
        }

        public Hierarchy build() {
            checkNotNull(observations, "observations must not be null");
            checkNotNull(groupingSpec, "grouping specification must not be null");
            if (observations.length == 0) {
                throw new InvalidStructureException("at least one period of data is required");
            }
            int bottomCount = observations[0].length;
            for (int t = 0; t < observations.length; t++) {
                if (observations[t].length != bottomCount) {
                    throw new InvalidStructureException("row " + t + " has " + observations[t].length
                            + " values, expected " + bottomCount);
                }
            }
            groupingSpec.validate(bottomCount);
            if (bottomLabels != null && bottomLabels.length != bottomCount) {
                throw new InvalidStructureException(
                        bottomLabels.length + " labels for " + bottomCount + " bottom series");
            }
            TimeIndex timeIndex = new TimeIndex(frequency, startYear, startCycle);

            double[][] bottomSeries = new double[bottomCount][observations.length];
            for (int t = 0; t < observations.length; t++) {
                for (int j = 0; j < bottomCount; j++) {
                    checkArgument(Double.isFinite(observations[t][j]),
                            "observations must be finite, found " + observations[t][j] + " at (" + t + ", " + j + ")");
                    bottomSeries[j][t] = observations[t][j];
                }
            }

            List<String> labels = new ArrayList<>();
            List<Integer> levels = new ArrayList<>();
            List<Integer> parents = new ArrayList<>();
            List<List<Integer>> children = new ArrayList<>();
            List<int[]> members = new ArrayList<>();

            if (!groupingSpec.isGrouped()) {
                int[] level = new int[bottomCount];
                for (int j = 0; j < bottomCount; j++) {
                    addNode(labels, levels, parents, children, childLabel("", j), 0, HierarchyNode.NO_PARENT);
                    level[j] = j;
                }
                members.add(level);
            } else {
                addNode(labels, levels, parents, children, ROOT_LABEL, 0, HierarchyNode.NO_PARENT);
                members.add(new int[] { 0 });
                for (int k = 0; k < groupingSpec.getDepth() - 1; k++) {
                    int[] branching = groupingSpec.getBranching(k);
                    int[] above = members.get(k);
                    List<Integer> current = new ArrayList<>();
                    for (int p = 0; p < above.length; p++) {
                        String prefix = (k == 0) ? "" : labels.get(above[p]);
                        for (int c = 0; c < branching[p]; c++) {
                            int index = addNode(labels, levels, parents, children, childLabel(prefix, c), k + 1,
                                    above[p]);
                            children.get(above[p]).add(index);
                            current.add(index);
                        }
                    }
                    members.add(current.stream().mapToInt(Integer::intValue).toArray());
                }
            }

            int[] leafLevel = members.get(members.size() - 1);
            if (bottomLabels != null) {
                for (int j = 0; j < leafLevel.length; j++) {
                    labels.set(leafLevel[j], bottomLabels[j]);
                }
            }

            int count = labels.size();
            int[] first = new int[count];
            int[] span = new int[count];
            for (int j = 0; j < leafLevel.length; j++) {
                first[leafLevel[j]] = j;
                span[leafLevel[j]] = 1;
            }
            // children always follow their parent in breadth first order
            for (int i = count - 1; i >= 0; i--) {
                List<Integer> kids = children.get(i);
                if (!kids.isEmpty()) {
                    first[i] = first[kids.get(0)];
                    span[i] = kids.stream().mapToInt(c -> span[c]).sum();
                }
            }

            HierarchyNode[] nodes = new HierarchyNode[count];
            for (int i = 0; i < count; i++) {
                nodes[i] = new HierarchyNode(i, labels.get(i), levels.get(i), parents.get(i),
                        children.get(i).stream().mapToInt(Integer::intValue).toArray(), first[i], span[i]);
            }
            AggregationMatrix summingMatrix = AggregationMatrix.fromNodes(nodes, bottomCount);
            return new Hierarchy(nodes, members.toArray(new int[0][]), summingMatrix, groupingSpec, timeIndex,
                    bottomSeries);
        }

        private static int addNode(List<String> labels, List<Integer> levels, List<Integer> parents,
                List<List<Integer>> children, String label, int level, int parent) {
            labels.add(label);
            levels.add(level);
            parents.add(parent);
            children.add(new ArrayList<>());
            return labels.size() - 1;
        }

        /**
         * Spreadsheet style letters: A to Z, then AA, AB and so on.
         */
        static String childLabel(String prefix, int position) {
            StringBuilder builder = new StringBuilder();
            int n = position;
            do {
                builder.insert(0, (char) ('A' + n % 26));
                n = n / 26 - 1;
            } while (n >= 0);
            return prefix + builder;
        }
    }
}
