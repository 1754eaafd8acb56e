package fun.fengwk.mfr.core.cli;

import fun.fengwk.mfr.core.service.extract.PostContentExtractor;
import fun.fengwk.mfr.core.service.extract.model.ExtractionResult;
import fun.fengwk.mfr.core.service.forum.ForumProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Extracts a saved post page or message fragment and prints the result.
 *
 * <p>Usage: {@code --extract-file=<path> [--base-url=<url>]}.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractCommand implements ApplicationRunner {

    static final String OPTION_FILE = "extract-file";
    static final String OPTION_BASE_URL = "base-url";

    private static final Pattern PAGE_PATTERN = Pattern.compile("<(?:html|body|td)\\b", Pattern.CASE_INSENSITIVE);

    private final PostContentExtractor postContentExtractor;
    private final ForumProperties forumProperties;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION_FILE)) {
            return;
        }
        String file = CommandOptions.firstValue(args, OPTION_FILE);
        String baseUrl = CommandOptions.firstValue(args, OPTION_BASE_URL);
        System.exit(execute(file, baseUrl == null ? forumProperties.getBaseUrl() : baseUrl, System.out));
    }

    /**
     * @return process exit code
     */
    int execute(String file, String baseUrl, PrintStream out) {
        if (file == null || file.isBlank()) {
            log.error("extract file not specified");
            return 2;
        }
        String html;
        try {
            html = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.error("read extract file failed, file={}, error={}", file, ex.getMessage());
            return 1;
        }

        ExtractionResult result;
        if (isPage(html)) {
            Document document = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
            Element message = document.selectFirst("td[id^=postmessage_]");
            result = postContentExtractor.extract(message == null ? document.body() : message, baseUrl);
        } else {
            result = postContentExtractor.extract(html, baseUrl);
        }
        print(result, out);
        return result.isFailed() ? 1 : 0;
    }

    private boolean isPage(String html) {
        return PAGE_PATTERN.matcher(html).find();
    }

    private void print(ExtractionResult result, PrintStream out) {
        out.println(result.text());
        printList(out, "图片", result.images());
        printList(out, "标签", result.tags());
    }

    private void printList(PrintStream out, String label, List<String> values) {
        if (!values.isEmpty()) {
            out.println();
            out.println(label + ":");
            values.forEach(value -> out.println("  " + value));
        }
    }

}
