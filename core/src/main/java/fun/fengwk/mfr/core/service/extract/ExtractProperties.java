package fun.fengwk.mfr.core.service.extract;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Post body extraction configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mfr.extract")
public class ExtractProperties {

    /**
     * Nesting depth beyond which subtrees are reduced to their plain text.
     */
    private int maxDepth = 256;

    /**
     * Zone used to render countdown timestamps, blank means the system zone.
     */
    private String zoneId = "";

    /**
     * Class fragments of presentational containers that are dropped.
     */
    private List<String> skipClasses = new ArrayList<>(List.of(
        "swi-block",
        "steam-info-wrapper",
        "tip",
        "steam-info-loading",
        "original_text_style1"
    ));

    /**
     * Style fragments that mark a widget caption span.
     */
    private List<String> captionStyleMarkers = new ArrayList<>(List.of(
        "font-size: 10px",
        "overflow: visible"
    ));

    /**
     * Lower-case token identifying storefront links and widgets.
     */
    private String storefrontToken = "steam";

    /**
     * Label printed for storefront links and widgets.
     */
    private String storefrontLabel = "Steam";

    /**
     * Lower-case token identifying countdown widgets.
     */
    private String countdownToken = "countdown";

    public ZoneId resolveZoneId() {
        if (!StringUtils.hasText(zoneId)) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(zoneId.trim());
    }

}
