package com.eyelevel.bordereaux.service.suggestion.ai.openrouter;

import com.eyelevel.bordereaux.common.apiclient.model.HeaderConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Attribution headers OpenRouter uses to identify the calling application.
 */
@Component("openRouterHeader")
public class OpenRouterHeaderConfig extends HeaderConfig {

    public OpenRouterHeaderConfig(@Value("${app.ai-client.referer:https://github.com/eyelevel/bordereaux-processor}")
                                  String referer,
                                  @Value("${app.ai-client.title:Bordereaux Template Mapper}") String title) {
        setHeaders(List.of(new Header("HTTP-Referer", referer), new Header("X-Title", title)));
    }
}
