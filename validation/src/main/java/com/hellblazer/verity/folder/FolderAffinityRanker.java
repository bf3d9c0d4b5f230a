/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Verity.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.verity.folder;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Associates auxiliary folders with a model folder by how many trailing path components they share. For the model
 * folder {@code /mario/model/body/c00} the animation folder {@code /mario/motion/body/c00} is a better match than
 * {@code /mario/motion/pump/c00}.
 *
 * @author hal.hildebrand
 */
public final class FolderAffinityRanker {

    private FolderAffinityRanker() {
    }

    /**
     * Number of equal path components counted from the end. The root counts as a component, so two identical
     * absolute paths score one more than their name count.
     */
    public static int affinity(Path target, Path candidate) {
        var a = reversedComponents(target);
        var b = reversedComponents(candidate);
        int count = 0;
        while (count < a.size() && count < b.size() && a.get(count).equals(b.get(count))) {
            count++;
        }
        return count;
    }

    /**
     * Folders with animations, best match last.
     */
    public static List<Ranked<ModelFolderState>> findAnimationFolders(ModelFolderState model,
                                                                      List<ModelFolderState> folders) {
        return rank(model.getFolder().folderPath(), folders, f -> f.getFolder().folderPath(),
                    f -> !f.getFolder().anims().isEmpty());
    }

    /**
     * Folders with a physics configuration, best match last.
     */
    public static List<Ranked<ModelFolderState>> findSwingFolders(ModelFolderState model,
                                                                  List<ModelFolderState> folders) {
        return rank(model.getFolder().folderPath(), folders, f -> f.getFolder().folderPath(),
                    f -> f.getSwingPrc().isPresent());
    }

    /**
     * Candidates accepted by the predicate, stably sorted by increasing affinity with the target. Each result keeps
     * the candidate's index in {@code candidates}.
     */
    public static <T> List<Ranked<T>> rank(Path target, List<T> candidates, Function<? super T, Path> pathOf,
                                           Predicate<? super T> predicate) {
        var ranked = new ArrayList<Ranked<T>>();
        for (int i = 0; i < candidates.size(); i++) {
            var candidate = candidates.get(i);
            if (predicate.test(candidate)) {
                ranked.add(new Ranked<>(i, candidate, affinity(target, pathOf.apply(candidate))));
            }
        }
        ranked.sort(Comparator.comparingInt(Ranked::affinity));
        return ranked;
    }

    private static List<String> reversedComponents(Path path) {
        var components = new ArrayList<String>();
        for (int i = path.getNameCount() - 1; i >= 0; i--) {
            components.add(path.getName(i).toString());
        }
        if (path.getRoot() != null) {
            components.add(path.getRoot().toString());
        }
        return components;
    }

    /**
     * A candidate folder with its index in the candidate list and its affinity score.
     */
    public record Ranked<T>(int index, T folder, int affinity) {
    }
}
