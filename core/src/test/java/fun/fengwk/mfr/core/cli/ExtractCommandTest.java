package fun.fengwk.mfr.core.cli;

import fun.fengwk.mfr.core.service.extract.ExtractProperties;
import fun.fengwk.mfr.core.service.extract.PostContentExtractor;
import fun.fengwk.mfr.core.service.extract.impl.PostContentExtractorImpl;
import fun.fengwk.mfr.core.service.extract.model.ExtractionResult;
import fun.fengwk.mfr.core.service.extract.parser.TagClassifier;
import fun.fengwk.mfr.core.service.extract.parser.TagCollector;
import fun.fengwk.mfr.core.service.extract.parser.TextAssembler;
import fun.fengwk.mfr.core.service.forum.ForumProperties;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class ExtractCommandTest {

    @TempDir
    Path tempDir;

    private ExtractCommand command;
    private ByteArrayOutputStream output;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        command = new ExtractCommand(
            new PostContentExtractorImpl(new ExtractProperties(), new TagClassifier(), new TagCollector(), new TextAssembler()),
            new ForumProperties()
        );
        output = new ByteArrayOutputStream();
        out = new PrintStream(output, true, StandardCharsets.UTF_8);
    }

    @Test
    public void shouldExtractMessageBodyFromSavedPage() throws IOException {
        Path page = tempDir.resolve("page.html");
        Files.writeString(page, """
            <html><body>
              <div id="nav">navigation</div>
              <table><tr><td id="postmessage_1">hello <img file="a.jpg"> <span class="tag">限免</span></td></tr></table>
            </body></html>
            """);

        int code = command.execute(page.toString(), "https://forum.test", out);

        String printed = output.toString(StandardCharsets.UTF_8);
        assertThat(code).isZero();
        assertThat(printed).startsWith("hello 限免");
        assertThat(printed).doesNotContain("navigation");
        assertThat(printed).contains("图片:", "  https://forum.test/a.jpg", "标签:", "  限免");
    }

    @Test
    public void shouldExtractWholeBodyWithoutMessageCell() throws IOException {
        Path fragment = tempDir.resolve("fragment.html");
        Files.writeString(fragment, "<b>bold</b> text");

        int code = command.execute(fragment.toString(), "https://forum.test", out);

        assertThat(code).isZero();
        assertThat(output.toString(StandardCharsets.UTF_8)).startsWith("**bold** text");
    }

    @Test
    public void shouldHandOverFragmentHtmlUnparsed() throws IOException {
        Path fragment = tempDir.resolve("fragment.html");
        Files.writeString(fragment, "<i>it</i> tail");
        PostContentExtractor extractor = mock(PostContentExtractor.class);
        when(extractor.extract("<i>it</i> tail", "https://forum.test"))
            .thenReturn(new ExtractionResult("*it* tail", List.of(), List.of()));
        ExtractCommand fragmentCommand = new ExtractCommand(extractor, new ForumProperties());

        int code = fragmentCommand.execute(fragment.toString(), "https://forum.test", out);

        assertThat(code).isZero();
        assertThat(output.toString(StandardCharsets.UTF_8)).startsWith("*it* tail");
        verify(extractor, never()).extract(any(Element.class), anyString());
    }

    @Test
    public void shouldExtractPageBodyWithoutHeadWhenMessageCellMissing() throws IOException {
        Path page = tempDir.resolve("page.html");
        Files.writeString(page, "<html><head><title>page title</title></head><body><b>bold</b> text</body></html>");

        int code = command.execute(page.toString(), "https://forum.test", out);

        assertThat(code).isZero();
        String printed = output.toString(StandardCharsets.UTF_8);
        assertThat(printed).startsWith("**bold** text");
        assertThat(printed).doesNotContain("page title");
    }

    @Test
    public void shouldFailForMissingFile() {
        assertThat(command.execute(tempDir.resolve("absent.html").toString(), "https://forum.test", out)).isEqualTo(1);
    }

    @Test
    public void shouldFailWithoutFile() {
        assertThat(command.execute(" ", "https://forum.test", out)).isEqualTo(2);
    }

}
