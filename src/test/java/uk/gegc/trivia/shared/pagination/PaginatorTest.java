package uk.gegc.trivia.shared.pagination;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaginatorTest {

    private static List<Integer> numbers(int count) {
        return IntStream.rangeClosed(1, count).boxed().collect(Collectors.toList());
    }

    @ParameterizedTest(name = "{0} items, page {1} -> {2} items")
    @CsvSource({
            "0, 1, 0",
            "5, 1, 5",
            "10, 1, 10",
            "10, 2, 0",
            "11, 2, 1",
            "25, 1, 10",
            "25, 2, 10",
            "25, 3, 5",
            "25, 4, 0",
            "25, 100, 0"
    })
    @DisplayName("slice length is min(10, max(0, L - (p-1)*10))")
    void slice_lengthFollowsFormula(int length, int page, int expected) {
        List<Integer> slice = Paginator.slice(numbers(length), page, 10);

        assertThat(slice).hasSize(expected);
        assertThat(slice.size()).isEqualTo(Math.min(10, Math.max(0, length - (page - 1) * 10)));
    }

    @Test
    @DisplayName("slice returns the items at the page offsets in order")
    void slice_returnsItemsAtOffsets() {
        assertThat(Paginator.slice(numbers(23), 3, 10)).containsExactly(21, 22, 23);
        assertThat(Paginator.slice(numbers(23), 2, 10)).containsExactly(11, 12, 13, 14, 15, 16, 17, 18, 19, 20);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, -5})
    @DisplayName("slice returns nothing for pages below 1")
    void slice_pagesBelowOne_empty(int page) {
        assertThat(Paginator.slice(numbers(30), page, 10)).isEmpty();
    }

    @Test
    @DisplayName("slice rejects a non-positive page size")
    void slice_invalidPageSize_throws() {
        assertThatThrownBy(() -> Paginator.slice(numbers(3), 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"abc", "1.5", "two", " "})
    @DisplayName("resolvePage falls back to page 1 for absent or non-numeric input")
    void resolvePage_fallsBackToDefault(String raw) {
        assertThat(Paginator.resolvePage(raw)).isEqualTo(Paginator.DEFAULT_PAGE);
    }

    @Test
    @DisplayName("resolvePage parses numeric input")
    void resolvePage_parsesNumbers() {
        assertThat(Paginator.resolvePage("3")).isEqualTo(3);
        assertThat(Paginator.resolvePage(" 2 ")).isEqualTo(2);
        assertThat(Paginator.resolvePage("0")).isZero();
    }

    @Test
    @DisplayName("resolvePage saturates numbers outside the int range instead of defaulting")
    void resolvePage_overflow_saturates() {
        assertThat(Paginator.resolvePage("99999999999")).isEqualTo(Integer.MAX_VALUE);
        assertThat(Paginator.resolvePage("-99999999999")).isEqualTo(Integer.MIN_VALUE);
        assertThat(Paginator.slice(List.of("a", "b"), Paginator.resolvePage("99999999999"), 10)).isEmpty();
    }
}
