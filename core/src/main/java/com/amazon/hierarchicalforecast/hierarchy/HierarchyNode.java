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

import java.util.Arrays;

import lombok.Getter;

/**
 * One series of the hierarchy. Nodes live in a single array owned by the
 * {@link Hierarchy}; parent and children are indexes into that array. Every
 * node covers a contiguous range of bottom series, starting at
 * {@code firstBottom} and {@code bottomSpan} long.
 */
@Getter
public class HierarchyNode {

    public static final int NO_PARENT = -1;

    public static final int NOT_A_LEAF = -1;

    private final int index;

    private final String label;

    private final int level;

    private final int parent;

    private final int[] children;

    private final int firstBottom;

    private final int bottomSpan;

    HierarchyNode(int index, String label, int level, int parent, int[] children, int firstBottom, int bottomSpan) {
        this.index = index;
        this.label = label;
        this.level = level;
        this.parent = parent;
        this.children = children;
        this.firstBottom = firstBottom;
        this.bottomSpan = bottomSpan;
    }

    public int[] getChildren() {
        return Arrays.copyOf(children, children.length);
    }

    public int getNumberOfChildren() {
        return children.length;
    }

    public boolean isLeaf() {
        return children.length == 0;
    }

    public boolean isRoot() {
        return parent == NO_PARENT;
    }

    /**
     * @return position of this leaf among the bottom series, or
     *         {@value #NOT_A_LEAF} for aggregate nodes
     */
    public int getBottomIndex() {
        return isLeaf() ? firstBottom : NOT_A_LEAF;
    }

    @Override
    public String toString() {
        return label + "@" + level;
    }
}
