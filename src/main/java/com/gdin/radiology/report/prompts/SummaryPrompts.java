package com.gdin.radiology.report.prompts;

public final class SummaryPrompts {

    private SummaryPrompts() {}

    public static final String SYSTEM_INSTRUCTION = """
You are an expert radiologist assistant. Generate a concise, clinically accurate \
impression and conclusion from the provided radiology report in {language_name}. \
Focus on the most important findings and their clinical significance. \
CRITICAL: Respond ONLY in {language_name} language, matching the language of the report.""";

    public static final String USER_PROMPT = """
Based on the following radiology report, generate BOTH a summary and a conclusion in {language_name}.

ORIGINAL CLINICAL INDICATION:
\"\"\"{indication}\"\"\"

FULL RADIOLOGY REPORT:
\"\"\"{report}\"\"\"

Generate TWO sections:

1. {summary_label} (Concise impression - {max_length} words max):
   - Summarize the key imaging findings
   - Prioritize clinically significant findings
   - Use clear, professional medical terminology
   - Structure as numbered points if multiple findings
   {example}

2. {conclusion_label} (Clinical conclusion based on indication):
   - Address the original clinical question/indication
   - Provide clinical interpretation
   - Suggest follow-up if needed
   - Be direct and actionable

IMPORTANT:
- Write ONLY in {language_name}
- Do NOT include section headers in your response
- Separate the summary and conclusion with a blank line
- First paragraph = Summary, Second paragraph = Conclusion

Generate the response:""";
}
