package org.example.gis2bim.conversion;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 转换服务的 Bean 装配。
 * <p>
 * 只依赖本地文件系统；批量模式的 runner 仅在配置了输入目录时注册。
 */
@Configuration(proxyBeanMethods = false)
public class ConversionConfiguration {

    @Bean
    public ConversionService conversionService(ConversionProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        return new ConversionService(properties, objectMapper.getIfAvailable(ObjectMapper::new), Clock.systemDefaultZone());
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.convert", name = "input-folder")
    public ConversionRunner conversionRunner(ConversionService conversionService, ConversionProperties properties) {
        return new ConversionRunner(conversionService, properties);
    }
}
