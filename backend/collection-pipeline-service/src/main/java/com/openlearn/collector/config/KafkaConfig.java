package com.openlearn.collector.config;

import com.openlearn.collector.dto.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.Map;

/**
 * Alert 이벤트 producer.
 *
 * 브로커/acks/retries 는 spring.kafka.producer.* 에서 읽고, 직렬화와 멱등성은 여기서 고정합니다.
 * 키는 sourceKey 이므로 같은 소스의 알림은 같은 파티션에 순서대로 쌓입니다.
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, AlertEvent> alertEventProducerFactory(KafkaProperties kafkaProperties,
                                                                         ObjectProvider<SslBundles> sslBundles) {
        Map<String, Object> props = kafkaProperties.buildProducerProperties(sslBundles.getIfAvailable());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.putIfAbsent(ProducerConfig.LINGER_MS_CONFIG, 5);
        log.debug("Alert producer bootstrap servers: {}", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, AlertEvent> alertEventKafkaTemplate(
            ProducerFactory<String, AlertEvent> alertEventProducerFactory,
            CollectorProperties properties) {
        KafkaTemplate<String, AlertEvent> template = new KafkaTemplate<>(alertEventProducerFactory);
        template.setDefaultTopic(properties.getAlerts().getPublish().getTopic());
        return template;
    }
}
