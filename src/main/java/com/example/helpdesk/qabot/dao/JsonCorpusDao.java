package com.example.helpdesk.qabot.dao;

import com.example.helpdesk.qabot.cache.ResourceLoadException;
import com.example.helpdesk.qabot.config.QaProperties;
import com.example.helpdesk.qabot.model.FaqEntry;
import com.example.helpdesk.qabot.model.ProductEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * Reads the corpora from JSON array files. Locations are Spring resource strings, so both
 * {@code classpath:} and {@code file:} work.
 */
@Slf4j
@Repository
public class JsonCorpusDao implements CorpusDao {

    private static final TypeReference<List<ProductEntry>> PRODUCT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<FaqEntry>> FAQ_LIST = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String productsLocation;
    private final String faqsLocation;

    @Autowired
    public JsonCorpusDao(ResourceLoader resourceLoader, ObjectMapper objectMapper, QaProperties properties) {
        this(resourceLoader,
                objectMapper,
                properties.getCorpus().getProductsLocation(),
                properties.getCorpus().getFaqsLocation());
    }

    public JsonCorpusDao(ResourceLoader resourceLoader,
                         ObjectMapper objectMapper,
                         String productsLocation,
                         String faqsLocation) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
        this.productsLocation = productsLocation;
        this.faqsLocation = faqsLocation;
    }

    @Override
    public List<ProductEntry> loadProducts() {
        return read(productsLocation, PRODUCT_LIST);
    }

    @Override
    public List<FaqEntry> loadFaqs() {
        return read(faqsLocation, FAQ_LIST);
    }

    private <T> List<T> read(String location, TypeReference<List<T>> type) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<T> entries = objectMapper.readValue(in, type);
            List<T> result = entries == null
                    ? List.of()
                    : entries.stream().filter(Objects::nonNull).toList();
            log.info("[corpus] Read {} entries from {}", result.size(), location);
            return result;
        } catch (IOException e) {
            throw new ResourceLoadException("Failed to read corpus from " + location, e);
        }
    }
}
