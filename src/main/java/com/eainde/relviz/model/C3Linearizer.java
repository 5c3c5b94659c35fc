package com.eainde.relviz.model;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * C3 merge over entity indices.
 *
 * <p>The linearization of an entity is the entity itself followed by the merge
 * of its bases' linearizations and the list of its bases. The merge repeatedly
 * takes the first head, scanning sequences left to right, that does not occur
 * in the tail of any sequence. This keeps local base order, keeps each
 * ancestor's own order, and puts a shared ancestor after everything that
 * derives from it.</p>
 */
final class C3Linearizer {

    private C3Linearizer() {
    }

    /**
     * @param entity             index of the entity being linearized
     * @param bases              indices of its direct bases, in declaration order
     * @param baseLinearizations linearization of each base, same order as {@code bases}
     * @return the linearization, or null if the orders cannot be merged
     */
    static List<Integer> linearize(int entity, List<Integer> bases, List<List<Integer>> baseLinearizations) {
        List<LinkedList<Integer>> sequences = new ArrayList<>(bases.size() + 1);
        for (List<Integer> linearization : baseLinearizations) {
            sequences.add(new LinkedList<>(linearization));
        }
        sequences.add(new LinkedList<>(bases));

        List<Integer> result = new ArrayList<>();
        result.add(entity);
        while (true) {
            sequences.removeIf(LinkedList::isEmpty);
            if (sequences.isEmpty()) {
                return result;
            }
            Integer next = null;
            for (LinkedList<Integer> sequence : sequences) {
                Integer head = sequence.getFirst();
                if (!inAnyTail(head, sequences)) {
                    next = head;
                    break;
                }
            }
            if (next == null) {
                return null;
            }
            result.add(next);
            for (LinkedList<Integer> sequence : sequences) {
                if (sequence.getFirst().equals(next)) {
                    sequence.removeFirst();
                }
            }
        }
    }

    private static boolean inAnyTail(Integer candidate, List<LinkedList<Integer>> sequences) {
        for (LinkedList<Integer> sequence : sequences) {
            if (sequence.indexOf(candidate) > 0) {
                return true;
            }
        }
        return false;
    }
}
