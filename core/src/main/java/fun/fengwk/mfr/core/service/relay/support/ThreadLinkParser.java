package fun.fengwk.mfr.core.service.relay.support;

import fun.fengwk.mfr.core.service.forum.ForumProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds forum thread links in free text.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ThreadLinkParser {

    private final ForumProperties forumProperties;

    /**
     * Thread ids of {@code <base>/thread-<n>} and {@code <base>/t<n>} links, distinct, in text order.
     */
    public List<Long> extractThreadIds(String text) {
        String baseUrl = forumProperties.normalizedBaseUrl();
        if (!StringUtils.hasText(text) || !StringUtils.hasText(baseUrl)) {
            return List.of();
        }
        Pattern pattern = Pattern.compile(Pattern.quote(baseUrl) + "/(?:thread-|t)(\\d+)");
        Matcher matcher = pattern.matcher(text);
        Set<Long> ids = new LinkedHashSet<>();
        while (matcher.find()) {
            try {
                ids.add(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException ex) {
                log.debug("skip thread id out of range, id={}", matcher.group(1));
            }
        }
        return new ArrayList<>(ids);
    }

}
