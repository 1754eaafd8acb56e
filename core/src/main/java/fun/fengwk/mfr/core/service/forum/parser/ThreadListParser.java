package fun.fengwk.mfr.core.service.forum.parser;

import fun.fengwk.mfr.core.service.extract.support.UrlResolver;
import fun.fengwk.mfr.core.service.forum.model.ThreadEntry;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the "new threads" guide page.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ThreadListParser {

    private static final Pattern THREAD_ID_PATTERN = Pattern.compile("/(?:t|thread-)(\\d+)");

    public List<ThreadEntry> parse(Document document, String baseUrl) {
        List<ThreadEntry> entries = new ArrayList<>();
        Element anchor = document.getElementById("forumnew");
        Element table = anchor == null ? null : anchor.nextElementSibling();
        if (table == null) {
            log.warn("thread list table not found, baseUrl={}", baseUrl);
            return entries;
        }
        for (Element row : table.children()) {
            if (!"tbody".equals(row.normalName())) {
                continue;
            }
            ThreadEntry entry = parseRow(row, baseUrl);
            if (entry != null) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private ThreadEntry parseRow(Element row, String baseUrl) {
        try {
            Element link = row.selectFirst("th.common > a");
            Element author = row.selectFirst("td.by > cite > a");
            if (link == null || author == null) {
                log.debug("skip thread row without title or author, rowId={}", row.id());
                return null;
            }
            String href = link.attr("href").trim();
            String url = UrlResolver.normalizeBaseUrl(baseUrl) + "/" + href;
            return new ThreadEntry(parseThreadId("/" + href), link.text().trim(), url, author.text().trim());
        } catch (RuntimeException ex) {
            log.error("parse thread row failed, rowId={}, error={}", row.id(), ex.getMessage());
            return null;
        }
    }

    /**
     * Reads the id from paths shaped like {@code .../t123456-1-1} or {@code .../thread-123456-1-1.html}.
     */
    static long parseThreadId(String path) {
        Matcher matcher = THREAD_ID_PATTERN.matcher(path);
        if (!matcher.find()) {
            throw new IllegalArgumentException("thread id not found in path: " + path);
        }
        return Long.parseLong(matcher.group(1));
    }

}
