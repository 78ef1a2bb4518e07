/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.ccfront.cc.compiler.visitors;

import org.ccfront.cc.ir.ICNode;
import org.ccfront.util.Logger;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Visits every distinct node reachable from a root exactly once.
 *
 * <p>Nodes are identified by {@link ICNode#getId()}, so a node reachable along
 * several paths, or through a cycle, is entered only the first time it is
 * reached.  Derived links (resolved declarations, inferred types) are not
 * followed.  Children are visited in source order, using each class's
 * {@link ICNode#accept} method, so traversal-only slots such as
 * names and literal texts are visited too.
 *
 * <p>A walker is used for a single traversal; the static methods create one per call.
 * Callbacks that want to stop early should ignore the remaining nodes
 * using their own flag.
 */
public class Walker extends CInnerVisitor {
    final Consumer<ICNode> onEnter;
    final Consumer<ICNode> onExit;
    final Set<Long> visited;

    public Walker(Consumer<ICNode> onEnter, Consumer<ICNode> onExit) {
        this.onEnter = onEnter;
        this.onExit = onExit;
        this.visited = new HashSet<>();
    }

    @Override
    public VisitDecision preorder(ICNode node) {
        if (!this.visited.add(node.getId())) {
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Already visited ")
                    .append(node.getClass().getSimpleName())
                    .append("#")
                    .append(node.getId())
                    .newline();
            return VisitDecision.STOP;
        }
        this.onEnter.accept(node);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(ICNode node) {
        this.onExit.accept(node);
    }

    /** Number of distinct nodes entered so far. */
    public int visitedCount() {
        return this.visited.size();
    }

    /** Calls onEnter before visiting the children of each node, and onExit after. */
    public static void walk(ICNode root, Consumer<ICNode> onEnter, Consumer<ICNode> onExit) {
        new Walker(onEnter, onExit).apply(root);
    }

    public static void walkPreorder(ICNode root, Consumer<ICNode> f) {
        walk(root, f, n -> {});
    }

    public static void walkPostorder(ICNode root, Consumer<ICNode> f) {
        walk(root, n -> {}, f);
    }
}
