package com.example.helpdesk.qabot.tokenizer;

import com.example.helpdesk.qabot.cache.ResourceLoadException;
import com.example.helpdesk.qabot.model.Token;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.ja.JapaneseTokenizer;
import org.apache.lucene.analysis.ja.tokenattributes.PartOfSpeechAttribute;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Japanese tokenizer backed by Lucene Kuromoji and its bundled IPADIC dictionary.
 * A Lucene tokenizer is single-use per stream, so one is opened per call; the dictionary itself
 * is loaded once per class loader, which the constructor forces so a broken dictionary fails
 * the resource load instead of the first question.
 */
@Slf4j
public class KuromojiMorphologicalTokenizer implements MorphologicalTokenizer {

    private static final String WARM_UP_TEXT = "辞書の読み込みを確認します";

    public KuromojiMorphologicalTokenizer() {
        try {
            List<Token> tokens = tokenize(WARM_UP_TEXT, 16);
            log.debug("[kuromoji] Dictionary ready ({} warm-up tokens)", tokens.size());
        } catch (RuntimeException | ExceptionInInitializerError | NoClassDefFoundError e) {
            throw new ResourceLoadException("Kuromoji dictionary could not be loaded", e);
        }
    }

    @Override
    public List<Token> tokenize(String text, int maxTokens) {
        if (text == null || text.isBlank() || maxTokens <= 0) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        try (JapaneseTokenizer tokenizer = new JapaneseTokenizer(null, true, JapaneseTokenizer.Mode.NORMAL)) {
            CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            PartOfSpeechAttribute pos = tokenizer.addAttribute(PartOfSpeechAttribute.class);
            tokenizer.setReader(new StringReader(text));
            tokenizer.reset();
            while (tokens.size() < maxTokens && tokenizer.incrementToken()) {
                tokens.add(new Token(term.toString(), coarse(pos.getPartOfSpeech())));
            }
            tokenizer.end();
        } catch (IOException e) {
            throw new UncheckedIOException("Tokenizing failed", e);
        }
        return tokens;
    }

    // IPADIC tags look like "名詞-固有名詞-一般"
    private static String coarse(String partOfSpeech) {
        if (partOfSpeech == null) {
            return "";
        }
        int dash = partOfSpeech.indexOf('-');
        return dash < 0 ? partOfSpeech : partOfSpeech.substring(0, dash);
    }
}
