package io.llmcouncil.core.council;

import java.util.List;
import java.util.stream.Collectors;

/// Prompt text for the peer ranking, rebuttal and chairman stages.
public final class CouncilPrompts {

    static final String CRITIQUE_SEPARATOR = "\n\n---\n\n";

    private CouncilPrompts() {}

    /// Builds the Stage 2 evaluation prompt. Answers appear only under their labels.
    ///
    /// @param userQuery the question being answered, not null
    /// @param answers Stage 1 answers in label order, not null
    /// @param labels label map of the round, not null
    /// @return prompt text, never null
    public static String ranking(String userQuery, List<ModelAnswer> answers, LabelMap labels) {
        List<String> labelList = labels.labels();
        StringBuilder responses = new StringBuilder();
        for (int i = 0; i < answers.size(); i++) {
            if (i > 0) {
                responses.append("\n\n");
            }
            responses.append(labelList.get(i)).append(":\n").append(answers.get(i).answerText());
        }

        return """
                You are evaluating different responses to the following question:

                Question: %s

                Here are the responses from different models (anonymized):

                %s

                Your task:
                1. First, evaluate each response individually. For each response, explain what it does well and what it does poorly.
                2. Then, at the very end of your response, provide a final ranking.

                IMPORTANT: Your final ranking MUST be formatted EXACTLY as follows:
                - Start with the line "FINAL RANKING:" (all caps, with colon)
                - Then list the responses from best to worst as a numbered list
                - Each line should be: number, period, space, then ONLY the response label (e.g., "1. Response A")
                - Do not add any other text or explanations in the ranking section

                Example of the correct format for your ENTIRE response:

                Response A provides good detail on X but misses Y...
                Response B is accurate but lacks depth on Z...
                Response C offers the most comprehensive answer...

                FINAL RANKING:
                1. Response C
                2. Response A
                3. Response B

                Now provide your evaluation and ranking:"""
                .formatted(userQuery, responses);
    }

    /// Formats the critiques forwarded to one author: every verdict, whole, tagged with its
    /// reviewer.
    ///
    /// @param verdicts verdicts to forward, not null
    /// @return critique block, empty when there are no verdicts
    public static String critiques(List<RankingVerdict> verdicts) {
        return verdicts.stream()
                .map(v -> "Critique from Peer (" + v.modelId() + "):\n" + v.rawText())
                .collect(Collectors.joining(CRITIQUE_SEPARATOR));
    }

    /// Builds the Stage 2.5 revision prompt for one author.
    ///
    /// @param userQuery original question, not null
    /// @param answer the author's current answer, not null
    /// @param label the author's label in the round, not null
    /// @param critiques formatted critiques, not null
    /// @return prompt text, never null
    public static String rebuttal(
            String userQuery, ModelAnswer answer, String label, String critiques) {
        return """
                You previously answered a user question. Other AI models have now reviewed and ranked all answers, including yours (you are identified as %s).

                Original Question: %s

                Your Original Answer:
                %s

                ---
                PEER REVIEWS AND RANKINGS:
                %s
                ---

                Your Task:
                1. Read the critiques of your specific answer (%s).
                2. Decide if you want to update or refine your answer based on valid points raised by peers.
                3. If your original answer was perfect, just repeat it. If you missed something, fix it.
                4. Provide your FINAL, revised answer. Do not include "Thinking" or meta-commentary about the process in the final output, just the answer.

                Revised Answer:"""
                .formatted(label, userQuery, answer.answerText(), critiques, label);
    }

    /// Builds the Stage 3 synthesis prompt.
    ///
    /// @param userQuery original question, not null
    /// @param answers final answers, possibly revised, not null
    /// @param verdicts Stage 2 verdicts, not null
    /// @return prompt text, never null
    public static String chairman(
            String userQuery, List<ModelAnswer> answers, List<RankingVerdict> verdicts) {
        StringBuilder stage1 = new StringBuilder();
        for (ModelAnswer answer : answers) {
            stage1.append("Model: ").append(answer.modelId()).append('\n');
            if (!answer.thinkingText().isEmpty()) {
                stage1.append("Thinking Process:\n").append(answer.thinkingText()).append("\n\n");
            }
            stage1.append("Response: ").append(answer.answerText()).append("\n\n");
        }

        String stage2 =
                verdicts.stream()
                        .map(v -> "Model: " + v.modelId() + "\nRanking: " + v.rawText())
                        .collect(Collectors.joining("\n\n"));

        return """
                You are the Chairman of an LLM Council. Multiple AI models have provided responses to a user's question, and then ranked each other's responses.

                Original Question: %s

                STAGE 1 - Individual Responses:
                %s

                STAGE 2 - Peer Rankings:
                %s

                Your task as Chairman is to synthesize all of this information into a single, comprehensive, accurate answer to the user's original question. Consider:
                - The individual responses and their insights
                - The peer rankings and what they reveal about response quality
                - Any patterns of agreement or disagreement

                Provide a clear, well-reasoned final answer that represents the council's collective wisdom:"""
                .formatted(userQuery, stage1, stage2);
    }
}
