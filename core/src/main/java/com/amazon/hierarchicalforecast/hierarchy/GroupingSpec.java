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

import static com.amazon.hierarchicalforecast.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

import com.amazon.hierarchicalforecast.errors.InvalidStructureException;

/**
 * The shape of a hierarchy as a list of per-level branching factors. Level
 * {@code k} of the specification lists, for every node at depth {@code k} (in
 * order), how many children it has at depth {@code k + 1}. The first level
 * therefore has a single entry, the number of children of the total, and the
 * entries of the last level add up to the number of bottom series.
 * <p>
 * For example {@code [2], [2, 6]} describes a total with two categories that
 * contain two and six products respectively. Its textual forms are
 * {@code "2;2,6"} and {@code "[2, (2,6)]"}.
 * <p>
 * The ungrouped specification describes a single-level structure where every
 * bottom series is its own node and nothing is aggregated.
 */
public class GroupingSpec {

    public static final String LEVEL_SEPARATOR = ";";

    public static final String COUNT_SEPARATOR = ",";

    public static final String UNGROUPED = "none";

    private static final GroupingSpec UNGROUPED_SPEC = new GroupingSpec(new int[0][]);

    private final int[][] levels;

    private GroupingSpec(int[][] levels) {
        this.levels = levels;
    }

    /**
     * @param levels branching factors, one array per level, starting with the
     *               children of the total
     * @return a grouping specification; consistency is checked against the data
     *         when the hierarchy is built
     */
    public static GroupingSpec of(int[]... levels) {
        checkNotNull(levels, "levels must not be null");
        if (levels.length == 0) {
            throw new InvalidStructureException("a grouped specification needs at least one level");
        }
        int[][] copy = new int[levels.length][];
        for (int i = 0; i < levels.length; i++) {
            checkNotNull(levels[i], "level must not be null");
            copy[i] = Arrays.copyOf(levels[i], levels[i].length);
        }
        return new GroupingSpec(copy);
    }

    /**
     * A total directly over the bottom series, with no intermediate level.
     *
     * @param bottomCount number of bottom series
     * @return the two-level specification
     */
    public static GroupingSpec flat(int bottomCount) {
        return of(new int[] { bottomCount });
    }

    public static GroupingSpec ungrouped() {
        return UNGROUPED_SPEC;
    }

    /**
     * Parses one of two textual forms. In the compact form levels are separated
     * by {@value #LEVEL_SEPARATOR} and the counts within a level by
     * {@value #COUNT_SEPARATOR}, as in {@code "2;2,6"}; brackets are ignored.
     * In the nested form, {@code "[2, (2,6)]"}, top-level commas separate the
     * levels and a parenthesised group holds the counts of one level. Blanks are
     * ignored in both. The empty string and {@value #UNGROUPED} denote the
     * ungrouped specification.
     *
     * @param text the textual form
     * @return the parsed specification
     */
    public static GroupingSpec parse(String text) {
        checkNotNull(text, "grouping text must not be null");
        String cleaned = text.replaceAll("\\s", "");
        if (cleaned.isEmpty() || UNGROUPED.equalsIgnoreCase(cleaned)) {
            return ungrouped();
        }
        List<int[]> levels = new ArrayList<>();
        if (cleaned.contains(LEVEL_SEPARATOR)) {
            for (String level : cleaned.replaceAll("[\\[\\]()]", "").split(LEVEL_SEPARATOR)) {
                levels.add(parseCounts(level, text));
            }
        } else {
            for (String level : splitNested(stripBrackets(cleaned, '[', ']', text), text)) {
                levels.add(parseCounts(stripBrackets(level, '(', ')', text), text));
            }
        }
        return of(levels.toArray(new int[0][]));
    }

    private static String stripBrackets(String value, char open, char close, String text) {
        if (!value.isEmpty() && value.charAt(0) == open) {
            if (value.charAt(value.length() - 1) != close) {
                throw new InvalidStructureException("unbalanced '" + open + "' in " + text);
            }
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static List<String> splitNested(String value, String text) {
        List<String> groups = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new InvalidStructureException("unbalanced ')' in " + text);
                }
            } else if (c == COUNT_SEPARATOR.charAt(0) && depth == 0) {
                groups.add(value.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new InvalidStructureException("unbalanced '(' in " + text);
        }
        groups.add(value.substring(start));
        return groups;
    }

    private static int[] parseCounts(String level, String text) {
        String[] counts = level.split(COUNT_SEPARATOR);
        int[] branching = new int[counts.length];
        for (int i = 0; i < counts.length; i++) {
            try {
                branching[i] = Integer.parseInt(counts[i]);
            } catch (NumberFormatException e) {
                throw new InvalidStructureException("not a branching factor: '" + counts[i] + "' in " + text, e);
            }
        }
        return branching;
    }

    public boolean isGrouped() {
        return levels.length > 0;
    }

    /**
     * @return number of node levels, total and bottom level included
     */
    public int getDepth() {
        return levels.length + 1;
    }

    /**
     * @param level a level of the specification, 0 being the children of the
     *              total
     * @return the branching factors of that level
     */
    public int[] getBranching(int level) {
        return Arrays.copyOf(levels[level], levels[level].length);
    }

    /**
     * Checks that the specification describes a tree whose leaves partition
     * exactly {@code bottomCount} series.
     *
     * @param bottomCount number of bottom series in the data
     * @throws InvalidStructureException if the specification is inconsistent
     */
    public void validate(int bottomCount) {
        if (bottomCount < 1) {
            throw new InvalidStructureException("at least one bottom series is required");
        }
        if (!isGrouped()) {
            return;
        }
        int parents = 1;
        for (int k = 0; k < levels.length; k++) {
            if (levels[k].length != parents) {
                throw new InvalidStructureException("level " + (k + 1) + " lists " + levels[k].length
                        + " branching factors but the level above has " + parents + " nodes");
            }
            int children = 0;
            for (int count : levels[k]) {
                if (count < 1) {
                    throw new InvalidStructureException("branching factors must be positive, found " + count
                            + " at level " + (k + 1));
                }
                children += count;
            }
            parents = children;
        }
        if (parents != bottomCount) {
            throw new InvalidStructureException(
                    "grouping " + this + " has " + parents + " leaves but the data has " + bottomCount + " series");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupingSpec)) {
            return false;
        }
        return Arrays.deepEquals(levels, ((GroupingSpec) o).levels);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(levels);
    }

    @Override
    public String toString() {
        if (!isGrouped()) {
            return UNGROUPED;
        }
        StringJoiner joiner = new StringJoiner(LEVEL_SEPARATOR);
        for (int[] level : levels) {
            StringJoiner counts = new StringJoiner(COUNT_SEPARATOR);
            Arrays.stream(level).forEach(c -> counts.add(Integer.toString(c)));
            joiner.add(counts.toString());
        }
        return joiner.toString();
    }
}
