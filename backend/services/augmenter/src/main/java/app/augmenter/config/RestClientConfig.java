package app.augmenter.config;

import app.augmenter.client.gemini.GeminiProps;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties({AugmentProps.class, AnkiConnectProps.class, GeminiProps.class})
public class RestClientConfig {

    @Bean
    public RestClient.Builder geminiRestClientBuilder(GeminiProps props) {
        return RestClient.builder()
                .requestFactory(requestFactory(Duration.ofSeconds(props.timeoutSeconds())));
    }

    @Bean
    public RestClient.Builder ankiConnectRestClientBuilder(AnkiConnectProps props) {
        return RestClient.builder()
                .requestFactory(requestFactory(Duration.ofSeconds(props.timeoutSeconds())));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private JdkClientHttpRequestFactory requestFactory(Duration readTimeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
