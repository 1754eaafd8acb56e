package fun.fengwk.mfr.core.service.forum.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Details read from a thread page.
 *
 * @author fengwk
 */
@Data
@Builder
public class PostDetails {

    private String title;
    private String author;
    private String content;
    private LocalDateTime publishTime;
    private List<String> images;
    private List<String> tags;

}
