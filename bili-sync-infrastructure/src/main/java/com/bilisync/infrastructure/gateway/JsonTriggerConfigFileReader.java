package com.bilisync.infrastructure.gateway;

import com.bilisync.domain.trigger.adapter.gateway.ITriggerConfigFileReader;
import com.bilisync.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * 基于 Spring Resource 的触发器配置文件读取，支持 classpath: 与 file: 前缀。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Component
public class JsonTriggerConfigFileReader implements ITriggerConfigFileReader {

    private final ResourceLoader resourceLoader;
    private final JsonCodec jsonCodec;

    public JsonTriggerConfigFileReader(ResourceLoader resourceLoader, JsonCodec jsonCodec) {
        this.resourceLoader = resourceLoader;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<Object> readItems(String location) throws IOException {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new FileNotFoundException("Trigger config file not found: " + location);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return jsonCodec.readList(inputStream);
        }
    }

    @Override
    public long lastModified(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            return -1L;
        }
        try {
            return resource.lastModified();
        } catch (IOException ex) {
            // jar 内资源没有修改时间
            log.debug("Trigger config file has no modification time. location={}, error={}", location, ex.getMessage());
            return -1L;
        }
    }
}
