package com.ciro.qform.spring;

import com.ciro.qform.FastForms;
import com.ciro.qform.dialect.FastFormsDialect;
import com.ciro.qform.render.HtmlFormRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(QFormProperties.class)
public class QFormAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QFormAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public HtmlFormRenderer htmlFormRenderer(QFormProperties props) {
        return new HtmlFormRenderer(props.toRenderConfig());
    }

    @Bean
    @ConditionalOnMissingBean
    public FastFormsDialect fastFormsDialect(HtmlFormRenderer renderer) {
        return new FastFormsDialect(renderer);
    }

    @Bean
    @ConditionalOnMissingBean
    public FastForms fastForms(FastFormsDialect dialect) {
        log.debug("Registering {} dialect v{}", dialect.info().title(), dialect.info().version());
        return new FastForms(dialect);
    }
}
