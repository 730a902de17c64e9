package org.learningjava.settingscan.config;

import okhttp3.OkHttpClient;
import org.learningjava.settingscan.application.port.UastParserPort;
import org.learningjava.settingscan.domain.service.extract.DefaultValueSerializer;
import org.learningjava.settingscan.domain.service.extract.PropertyFlagResolver;
import org.learningjava.settingscan.domain.service.extract.SettingRecordExtractor;
import org.learningjava.settingscan.infrastructure.adapter.out.uastParser.JavaParserUastAdapter;
import org.learningjava.settingscan.infrastructure.adapter.out.uastParser.RemoteUastParserAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    DefaultValueSerializer defaultValueSerializer() {
        return new DefaultValueSerializer();
    }

    @Bean
    PropertyFlagResolver propertyFlagResolver(SettingScanProperties props) {
        return new PropertyFlagResolver(props.getPropertyAnchorName());
    }

    @Bean
    SettingRecordExtractor settingRecordExtractor(SettingScanProperties props,
                                                  DefaultValueSerializer defaultValues,
                                                  PropertyFlagResolver flags) {
        return new SettingRecordExtractor(props.getSettingTypeName(), defaultValues, flags);
    }

    //objects with external dependencies
    @Bean
    UastParserPort uastParser(SettingScanProperties props) {
        if (props.getParser() == SettingScanProperties.ParserMode.REMOTE) {
            SettingScanProperties.Remote remote = props.getRemote();
            log.info("Using remote tree producer at {}", props.getServiceEndpoint());
            OkHttpClient http = new OkHttpClient.Builder()
                    .connectTimeout(remote.getConnectTimeout())
                    .readTimeout(remote.getReadTimeout())
                    .build();
            return new RemoteUastParserAdapter(props.getServiceEndpoint(), http,
                    remote.getMaxAttempts(), remote.getInitialBackoff(), remote.getMultiplier());
        }
        log.info("Using in-process JavaParser tree producer");
        return new JavaParserUastAdapter();
    }
}
