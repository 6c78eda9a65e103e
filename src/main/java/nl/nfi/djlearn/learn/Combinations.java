package nl.nfi.djlearn.learn;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

final class Combinations {

    private Combinations() {
    }

    /**
     * Visits every size-k subset of the elements, in lexicographic index order.
     */
    static <T> void forEach(final List<T> elements, final int k, final Consumer<List<T>> visitor) {
        if (k <= 0 || k > elements.size()) {
            return;
        }
        final int[] indices = new int[k];
        for (int i = 0; i < k; i++) {
            indices[i] = i;
        }
        while (true) {
            final List<T> subset = new ArrayList<>(k);
            for (final int index : indices) {
                subset.add(elements.get(index));
            }
            visitor.accept(subset);

            int i = k - 1;
            while (i >= 0 && indices[i] == elements.size() - k + i) {
                i--;
            }
            if (i < 0) {
                return;
            }
            indices[i]++;
            for (int j = i + 1; j < k; j++) {
                indices[j] = indices[j - 1] + 1;
            }
        }
    }
}
