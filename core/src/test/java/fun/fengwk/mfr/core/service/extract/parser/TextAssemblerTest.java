package fun.fengwk.mfr.core.service.extract.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class TextAssemblerTest {

    private final TextAssembler textAssembler = new TextAssembler();

    @Test
    public void shouldJoinFragmentsWithSingleSpace() {
        assertThat(textAssembler.assemble(List.of("a", "b", "c"))).isEqualTo("a b c");
    }

    @Test
    public void shouldCollapseHorizontalSpace() {
        assertThat(textAssembler.assemble(List.of("a  \t b", "  c"))).isEqualTo("a b c");
    }

    @Test
    public void shouldCollapseBlankLineRuns() {
        String text = textAssembler.assemble(List.of("alpha", "\n", "\n", "\n", "beta\n  \n\t\n gamma"));

        assertThat(text).isEqualTo("alpha \n\n beta\n\n gamma");
        assertThat(text).doesNotContain("\n\n\n");
    }

    @Test
    public void shouldTrimEnds() {
        assertThat(textAssembler.assemble(List.of("\n", "  body  ", "\n"))).isEqualTo("body");
    }

    @Test
    public void shouldReturnEmptyForNoFragments() {
        assertThat(textAssembler.assemble(List.of())).isEmpty();
        assertThat(textAssembler.assemble(null)).isEmpty();
    }

    @Test
    public void shouldBeIdempotent() {
        String once = textAssembler.assemble(List.of("  x ", "\n", "\n\n", "**y**", "\t z  \n \n \n w "));

        assertThat(textAssembler.assemble(List.of(once))).isEqualTo(once);
        assertThat(textAssembler.normalize(once)).isEqualTo(once);
    }

}
