package fun.fengwk.mfr.core.service.extract.impl;

import fun.fengwk.mfr.core.service.extract.ExtractProperties;
import fun.fengwk.mfr.core.service.extract.PostContentExtractor;
import fun.fengwk.mfr.core.service.extract.model.ExtractionResult;
import fun.fengwk.mfr.core.service.extract.model.NodeRule;
import fun.fengwk.mfr.core.service.extract.parser.TagClassifier;
import fun.fengwk.mfr.core.service.extract.parser.TagCollector;
import fun.fengwk.mfr.core.service.extract.parser.TextAssembler;
import fun.fengwk.mfr.core.service.extract.support.MarkupTexts;
import fun.fengwk.mfr.core.service.extract.support.UrlResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Recursive walk over a forum message body.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PostContentExtractorImpl implements PostContentExtractor {

    private static final DateTimeFormatter COUNTDOWN_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String COUNTDOWN_PARAM = "t";

    private final ExtractProperties extractProperties;
    private final TagClassifier tagClassifier;
    private final TagCollector tagCollector;
    private final TextAssembler textAssembler;

    @Override
    public ExtractionResult extract(Element root, String baseUrl) {
        if (root == null) {
            log.error("extract content failed, root is null, baseUrl={}", baseUrl);
            return ExtractionResult.failed();
        }
        try {
            ExtractionContext context = new ExtractionContext(UrlResolver.normalizeBaseUrl(baseUrl));
            walk(root, context);
            List<String> tags = tagCollector.collect(root);
            return new ExtractionResult(textAssembler.assemble(context.getFragments()), context.getImages(), tags);
        } catch (RuntimeException ex) {
            log.error("extract content failed, baseUrl={}, error={}", baseUrl, ex.getMessage(), ex);
            return ExtractionResult.failed();
        }
    }

    @Override
    public ExtractionResult extract(String bodyHtml, String baseUrl) {
        Document document = Jsoup.parseBodyFragment(bodyHtml == null ? "" : bodyHtml, baseUrl == null ? "" : baseUrl);
        return extract(document.body(), baseUrl);
    }

    private void walk(Element element, ExtractionContext context) {
        // text following a dropped node goes with it
        boolean dropTail = false;
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode textNode) {
                if (!dropTail) {
                    context.emit(MarkupTexts.trim(textNode.getWholeText()));
                }
            } else if (child instanceof Element childElement) {
                dropTail = !visit(childElement, context);
            }
        }
    }

    /**
     * @return false when the node was dropped together with its tail text
     */
    private boolean visit(Element element, ExtractionContext context) {
        NodeRule rule = tagClassifier.classify(element);
        try {
            return apply(rule, element, context);
        } catch (RuntimeException ex) {
            log.debug("node rule failed, fall back to plain walk, tag={}, rule={}, error={}",
                element.normalName(), rule, ex.getMessage());
            descend(element, context);
            return true;
        }
    }

    private boolean apply(NodeRule rule, Element element, ExtractionContext context) {
        switch (rule) {
            case IMAGE -> collectImage(element, context);
            case LINK -> {
                return emitLink(element, context);
            }
            case EMBEDDED_FRAME -> emitEmbeddedFrame(element, context);
            case HEADING -> emitWrapped(element, context, "\n**", "**\n");
            case QUOTATION -> emitQuotation(element, context);
            case LINE_BREAK -> context.emit("\n");
            case INLINE_CONTAINER -> {
                if (isSuppressedTrailer(element, context)) {
                    context.setSuppressTrailer(false);
                    return false;
                }
                if (hasSkippedClass(element)) {
                    return false;
                }
                descend(element, context);
            }
            case BLOCK_CONTAINER -> {
                if (hasSkippedClass(element)) {
                    return false;
                }
                descend(element, context);
            }
            case BOLD -> emitWrapped(element, context, "**", "**");
            case ITALIC -> emitWrapped(element, context, "*", "*");
            case PARAGRAPH -> emitWrapped(element, context, "\n", "\n");
            case SKIPPED -> {
                return false;
            }
            case TRANSPARENT -> descend(element, context);
        }
        return true;
    }

    private void descend(Element element, ExtractionContext context) {
        if (context.getDepth() >= extractProperties.getMaxDepth()) {
            log.debug("max depth reached, flatten subtree, tag={}, depth={}", element.normalName(), context.getDepth());
            context.emit(MarkupTexts.flattenText(element));
            return;
        }
        context.enter();
        try {
            walk(element, context);
        } finally {
            context.exit();
        }
    }

    private void collectImage(Element element, ExtractionContext context) {
        String file = element.attr("file");
        if (file.isEmpty() || UrlResolver.isDataPayload(file)) {
            return;
        }
        context.addImage(UrlResolver.resolve(context.getBaseUrl(), file));
    }

    private boolean emitLink(Element element, ExtractionContext context) {
        String href = element.attr("href");
        String text = MarkupTexts.flattenText(element);
        String lowerHref = href.toLowerCase(Locale.ROOT);

        if (lowerHref.contains(extractProperties.getStorefrontToken())) {
            String target = text.isEmpty() ? href : text;
            context.emit("[" + extractProperties.getStorefrontLabel() + "链接: " + target + "]");
        } else if (href.startsWith("#")) {
            context.emit(text);
        } else if (lowerHref.startsWith("javascript:")) {
            log.debug("skip script link, text={}", text);
            return false;
        } else if (!href.isEmpty() && !text.isEmpty()) {
            context.emit("[链接: " + text + " - " + UrlResolver.resolve(context.getBaseUrl(), href) + "]");
        } else {
            context.emit(text);
        }
        return true;
    }

    private void emitEmbeddedFrame(Element element, ExtractionContext context) {
        String src = element.attr("src");
        String lowerSrc = src.toLowerCase(Locale.ROOT);

        if (lowerSrc.contains(extractProperties.getStorefrontToken())) {
            String appUrl = stripQuery(src.replace("widget", "app"));
            context.emit("[" + extractProperties.getStorefrontLabel() + "小部件: " + appUrl + "]");
            context.setSuppressTrailer(true);
        } else if (lowerSrc.contains(extractProperties.getCountdownToken())) {
            String countdown = formatCountdown(queryParameter(src, COUNTDOWN_PARAM));
            if (countdown == null) {
                log.debug("skip countdown without numeric timestamp, src={}", src);
                return;
            }
            context.emit("[倒计时: " + countdown + "]");
        } else {
            context.emit("[嵌入内容]");
        }
    }

    private void emitWrapped(Element element, ExtractionContext context, String prefix, String suffix) {
        String text = MarkupTexts.flattenText(element);
        if (!text.isEmpty()) {
            context.emit(prefix + text + suffix);
        }
    }

    private void emitQuotation(Element element, ExtractionContext context) {
        String text = MarkupTexts.flattenText(element);
        if (text.isEmpty()) {
            return;
        }
        StringJoiner quoted = new StringJoiner("\n");
        for (String line : text.split("\n")) {
            if (!line.isBlank()) {
                quoted.add("> " + line);
            }
        }
        context.emit("\n" + quoted + "\n");
    }

    private boolean isSuppressedTrailer(Element element, ExtractionContext context) {
        if (!context.isSuppressTrailer()) {
            return false;
        }
        String style = element.attr("style");
        boolean captionStyled = extractProperties.getCaptionStyleMarkers().stream().anyMatch(style::contains);
        if (!captionStyled) {
            return false;
        }
        String token = extractProperties.getStorefrontToken();
        if (MarkupTexts.flattenText(element).toLowerCase(Locale.ROOT).contains(token)) {
            return true;
        }
        for (Element link : element.select("a[href]")) {
            if (link.attr("href").toLowerCase(Locale.ROOT).contains(token)) {
                return true;
            }
        }
        return false;
    }

    private boolean hasSkippedClass(Element element) {
        String className = element.attr("class");
        if (className.isEmpty()) {
            return false;
        }
        for (String skipClass : extractProperties.getSkipClasses()) {
            if (className.contains(skipClass)) {
                return true;
            }
        }
        return false;
    }

    private String formatCountdown(String timestamp) {
        if (timestamp == null || timestamp.isEmpty() || !timestamp.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            LocalDateTime time = LocalDateTime.ofInstant(
                Instant.ofEpochSecond(Long.parseLong(timestamp)),
                extractProperties.resolveZoneId()
            );
            return COUNTDOWN_FORMATTER.format(time);
        } catch (NumberFormatException | DateTimeException ex) {
            log.debug("countdown timestamp out of range, timestamp={}, error={}", timestamp, ex.getMessage());
            return null;
        }
    }

    private String stripQuery(String url) {
        int queryIndex = url.indexOf('?');
        return queryIndex >= 0 ? url.substring(0, queryIndex) : url;
    }

    private String queryParameter(String url, String name) {
        int queryIndex = url.indexOf('?');
        if (queryIndex < 0) {
            return null;
        }
        String query = url.substring(queryIndex + 1);
        int fragmentIndex = query.indexOf('#');
        if (fragmentIndex >= 0) {
            query = query.substring(0, fragmentIndex);
        }
        for (String pair : query.split("&")) {
            int eqIndex = pair.indexOf('=');
            String key = eqIndex >= 0 ? pair.substring(0, eqIndex) : pair;
            if (name.equals(key)) {
                return eqIndex >= 0 ? pair.substring(eqIndex + 1) : "";
            }
        }
        return null;
    }

}
