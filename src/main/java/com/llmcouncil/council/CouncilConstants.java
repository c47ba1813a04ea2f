package com.llmcouncil.council;

public final class CouncilConstants {

    private CouncilConstants() {
        // Private constructor to prevent instantiation
    }

    // Request purposes
    public static final String PURPOSE_STAGE1 = "stage1-answer";
    public static final String PURPOSE_STAGE2 = "stage2-ranking";
    public static final String PURPOSE_STAGE3 = "stage3-synthesis";
    public static final String PURPOSE_TITLE = "title";

    // Labels
    public static final String LABEL_PREFIX = "Response ";

    // Fallbacks
    public static final String DEFAULT_TITLE = "New Conversation";
    public static final String SYNTHESIS_FAILED_MESSAGE = "Error: Unable to generate final synthesis.";
    public static final int MAX_TITLE_LENGTH = 50;

    public static final String STAGE2_RANKING_PROMPT = """
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

            Now provide your evaluation and ranking:""";

    public static final String STAGE3_CHAIRMAN_PROMPT = """
            You are the Chairman of an LLM Council. Multiple AI models have provided responses to a user's question, and then ranked each other's responses.

            Original Question: %s

            STAGE 1 - Individual Responses:
            %s

            STAGE 2 - Peer Rankings:
            %s

            Aggregate leaderboard (lower average rank is better):
            %s

            Your task as Chairman is to synthesize all of this information into a single, comprehensive, accurate answer to the user's original question. Consider:
            - The individual responses and their insights
            - The peer rankings and what they reveal about response quality
            - Any patterns of agreement or disagreement

            Provide a clear, well-reasoned final answer that represents the council's collective wisdom:""";

    public static final String TITLE_PROMPT = """
            Generate a very short title (3-5 words maximum) that summarizes the following question.
            The title should be concise and descriptive. Do not use quotes or punctuation in the title.

            Question: %s

            Title:""";

    public static final String NO_RANKINGS_PLACEHOLDER = "No usable peer rankings were produced.";
}
