package buaa.detect.config;

import cn.hutool.core.util.StrUtil;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP客户端配置, 用于调用外部推理服务
 */
@Configuration
public class HttpClientConfiguration {

    /**
     * 推理响应可能包含大量检测框，缓冲区放大到16MB
     */
    private static final int MAX_BUFFER_SIZE = 16 * 1024 * 1024;

    @Bean
    public WebClient detectorWebClient(EvaluationConfiguration configuration) {
        EvaluationConfiguration.DetectorApi api = configuration.getDetector();
        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(codecConfigurer -> codecConfigurer
                .defaultCodecs()
                .maxInMemorySize(MAX_BUFFER_SIZE))
            .build();

        WebClient.Builder builder = WebClient.builder()
            .baseUrl(api.getBaseUrl())
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StrUtil.isNotBlank(api.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + api.getApiKey());
        }
        return builder.build();
    }
}
