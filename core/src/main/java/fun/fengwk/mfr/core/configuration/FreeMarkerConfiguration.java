package fun.fengwk.mfr.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    @Bean(name = "relayTemplateConfiguration")
    public freemarker.template.Configuration relayTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_33);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), "/templates/");
        cfg.setDefaultEncoding("UTF-8");
        return cfg;
    }

}
