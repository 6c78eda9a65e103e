package nl.nfi.djlearn.learn;

import nl.nfi.djlearn.constraint.ConstraintParser;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateSetTest {

    private static Candidate candidate(final String constraint) {
        return Candidate.of(ConstraintParser.parse(constraint));
    }

    @Test
    void deduplicatesByText() {
        final CandidateSet set = new CandidateSet();

        assertThat(set.add(candidate("int(<n>) == 1"))).isTrue();
        assertThat(set.add(candidate("int(<n>)==1"))).isFalse();
        assertThat(set).hasSize(1);
        assertThat(set.contains(candidate("int(<n>) == 1"))).isTrue();
    }

    @Test
    void removalMovesLastElementIntoSlot() {
        final CandidateSet set = new CandidateSet(List.of(candidate("int(<n>) == 1"), candidate("int(<n>) == 2"), candidate("int(<n>) == 3"), candidate("int(<n>) == 4")));

        assertThat(set.remove(candidate("int(<n>) == 2"))).isTrue();
        assertThat(set.remove(candidate("int(<n>) == 2"))).isFalse();
        assertThat(set).extracting(Candidate::text).containsExactly("int(<n>) == 1", "int(<n>) == 4", "int(<n>) == 3");

        assertThat(set.remove(candidate("int(<n>) == 3"))).isTrue();
        assertThat(set).extracting(Candidate::text).containsExactly("int(<n>) == 1", "int(<n>) == 4");
        assertThat(set.add(candidate("int(<n>) == 2"))).isTrue();
        assertThat(set).hasSize(3);
    }

    @Test
    void iteratorRemovalVisitsEveryElement() {
        final CandidateSet set = new CandidateSet();
        for (int i = 0; i < 10; i++) {
            set.add(candidate("int(<n>) == %d".formatted(i)));
        }

        int visited = 0;
        final Iterator<Candidate> iterator = set.iterator();
        while (iterator.hasNext()) {
            final Candidate candidate = iterator.next();
            visited++;
            if (candidate.text().endsWith("0") || candidate.text().endsWith("5") || candidate.text().endsWith("9")) {
                iterator.remove();
            }
        }

        assertThat(visited).isEqualTo(10);
        assertThat(set).hasSize(7);
        assertThat(set).extracting(Candidate::text).doesNotContain("int(<n>) == 0", "int(<n>) == 5", "int(<n>) == 9");
    }
}
