package dev.llmbench.eval;

import dev.llmbench.catalog.EvaluationMethod;
import dev.llmbench.catalog.PromptCase;
import dev.llmbench.extract.ExtractedResponse;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heuristic grading of open-ended writing.
 *
 * <p>Components, each capped:
 *
 * <ul>
 *   <li>length: one point per 50 characters, up to 20
 *   <li>structure: 10 for more than one paragraph, 5 for markdown emphasis or headings
 *   <li>relevance: prompt words longer than four characters found in the reply, up to 40
 *   <li>variety: 5 per distinct sentence length (in words), up to 25
 * </ul>
 */
public final class CreativityEvaluator implements Evaluator {
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern MARKDOWN = Pattern.compile("\\*\\*|\\*|_|#");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    @Override
    public EvaluationMethod method() {
        return EvaluationMethod.CREATIVITY_EVALUATION;
    }

    @Override
    public Evaluation evaluate(PromptCase promptCase, ExtractedResponse response) {
        var content = response.content();
        if (content.isEmpty() || promptCase.evaluationCriteria().isEmpty()) {
            return Evaluation.zero(method().tag(), "No content or evaluation criteria");
        }

        var lengthPoints = Math.min(content.length() / 50.0, 20);

        var paragraphs = PARAGRAPH_BREAK.split(content, -1).length;
        var hasFormatting = MARKDOWN.matcher(content).find();
        var structurePoints = (paragraphs > 1 ? 10 : 0) + (hasFormatting ? 5 : 0);

        var lowerContent = content.toLowerCase(Locale.ROOT);
        var keywords = promptKeywords(promptCase.prompt());
        var matched = keywords.stream().filter(lowerContent::contains).count();
        var relevancePoints =
                keywords.isEmpty() ? 0 : Math.min(matched * (40.0 / keywords.size()), 40);

        var sentenceLengths =
                Arrays.stream(SENTENCE_END.split(content, -1))
                        .map(sentence -> sentence.trim().split(" ", -1).length)
                        .collect(Collectors.toSet());
        var varietyPoints = Math.min(sentenceLengths.size() * 5, 25);

        var details = new LinkedHashMap<String, Object>();
        details.put("method", method().tag());
        details.put("lengthScore", lengthPoints);
        details.put("paragraphs", paragraphs);
        details.put("hasFormatting", hasFormatting);
        details.put("relevanceScore", relevancePoints);
        details.put("varietyScore", varietyPoints);
        return new Evaluation(
                lengthPoints + structurePoints + relevancePoints + varietyPoints, details);
    }

    static LinkedHashSet<String> promptKeywords(String prompt) {
        return Arrays.stream(prompt.toLowerCase(Locale.ROOT).split(" "))
                .filter(word -> word.length() > 4)
                .map(word -> word.replaceAll("[.,?!;:]", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
