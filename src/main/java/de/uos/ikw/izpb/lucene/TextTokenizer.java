package de.uos.ikw.izpb.lucene;

import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Wrapper over Lucene's StandardTokenizer (Unicode word segmentation) that keeps the surface form
 * and the character offsets of each token. No lower-casing or stop word removal is applied, the
 * case of a token is needed to recognize nouns.
 */
public class TextTokenizer {

    /**
     * Token of a text.
     * text [String] : surface form.
     * begin [int]   : offset of the first character.
     * end [int]     : offset after the last character.
     * index [int]   : position of the token in the text.
     */
    public record Token(String text, int begin, int end, int index) {

        public boolean isCapitalized() {
            return !text.isEmpty() && Character.isUpperCase(text.codePointAt(0));
        }
    }

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        try (StandardTokenizer tokenizer = new StandardTokenizer()) {
            CharTermAttribute term = tokenizer.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = tokenizer.addAttribute(OffsetAttribute.class);
            tokenizer.setReader(new StringReader(text));
            tokenizer.reset();
            while (tokenizer.incrementToken()) {
                tokens.add(new Token(term.toString(), offset.startOffset(), offset.endOffset(), tokens.size()));
            }
            tokenizer.end();
        } catch (IOException e) {
            // StringReader does not fail
            throw new UncheckedIOException("IOException while tokenizing text", e);
        }
        return tokens;
    }

    public int countTokens(String text) {
        return tokenize(text).size();
    }
}
