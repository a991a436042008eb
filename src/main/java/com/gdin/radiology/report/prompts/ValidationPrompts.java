package com.gdin.radiology.report.prompts;

public final class ValidationPrompts {

    private ValidationPrompts() {}

    public static final String SYSTEM_INSTRUCTION = """
You are an expert medical quality assurance assistant. Analyze radiology reports \
for inconsistencies, errors, and logical contradictions between findings and impressions. \
Respond in {language_name}.""";

    public static final String USER_PROMPT = """
Analyze the following radiology report for inconsistencies, errors, and contradictions.
Respond in {language_name}.

REPORT:
{report}

Check for:
1. Contradictions between Findings and Impression/Conclusion
2. Severity mismatches (e.g., normal findings but abnormal conclusion)
3. Missing critical information
4. Logical inconsistencies
5. Unclear or ambiguous statements that could lead to misinterpretation

Respond in the following format (in {language_name}):
ERRORS: [list critical issues that must be fixed]
WARNINGS: [list minor issues or potential concerns]
INCONSISTENCIES: [list specific contradictions found]
SEVERITY: [high/medium/low]

Leave a list empty ([]) when there is nothing to report.
Be specific and reference the conflicting statements.""";
}
