package pl.marcinmilkowski.constraint_kb.report;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.util.CharTokenizer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits transcription text on whitespace and word separators ('.') and lowercases tokens.
 */
public final class FragmentAnalyzer extends Analyzer {

    static final String FIELD = "fragment";

    @Override
    protected TokenStreamComponents createComponents(String fieldName) {
        Tokenizer source = CharTokenizer.fromSeparatorCharPredicate(c -> Character.isWhitespace(c) || c == '.');
        TokenStream result = new LowerCaseFilter(source);
        return new TokenStreamComponents(source, result);
    }

    /**
     * Tokenize one line of text.
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        try (TokenStream stream = tokenStream(FIELD, text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            // StringReader input; only reachable through a broken analysis chain
            throw new UncheckedIOException("Failed to tokenize fragment", e);
        }
        return tokens;
    }
}
