package com.example.helpdesk.qabot.dao;

import com.example.helpdesk.qabot.model.FaqEntry;
import com.example.helpdesk.qabot.model.ProductEntry;

import java.util.List;

public interface CorpusDao {

    /**
     * Read the whole product corpus.
     *
     * @throws com.example.helpdesk.qabot.cache.ResourceLoadException when the source cannot be read or parsed
     */
    List<ProductEntry> loadProducts();

    /**
     * Read the whole FAQ corpus.
     *
     * @throws com.example.helpdesk.qabot.cache.ResourceLoadException when the source cannot be read or parsed
     */
    List<FaqEntry> loadFaqs();
}
