package com.gdin.radiology.report.prompts;

public final class ReportGenerationPrompts {

    private ReportGenerationPrompts() {}

    public static final String SYSTEM_INSTRUCTION = """
You are a professional radiology reporting assistant.
CRITICAL: You MUST follow the provided template structure EXACTLY.
Rules:
1. Keep ALL sections, headers, and formatting from the template
2. Replace ALL placeholders like <fill>, <à remplir>, <concisely>, etc. with actual clinical findings
3. Fill EVERY section - do NOT leave any <placeholders> unfilled
4. Do NOT skip any sections from the template
5. Do NOT add extra sections not in the template
6. Use professional medical terminology appropriate for formal radiology reports
7. Base your findings on the clinical indication provided
8. Use negative findings when appropriate (e.g., 'No evidence of pulmonary embolism', 'Pas de signe de...', 'Normal')
9. Be concise but complete in each section
10. Do NOT include markdown formatting, code blocks, or backticks
11. Write the report in the language requested by the user prompt
Output ONLY the completed report with all placeholders filled.""";

    public static final String USER_PROMPT = """
Indication text (verbatim user input):
\"\"\"{indication}\"\"\"

Hospital: {hospital_name}
Reporting Radiologist: {doctor_name}
Referring Physician: {referrer}
Patient: {patient_name}
Study Date/Time: {study_datetime}
Accession/ID: {accession}
{similar_cases}
INSTRUCTIONS:
You must produce a complete radiology report following the template below EXACTLY.
- Keep the EXACT structure, sections, headers, and formatting
- Replace ALL <fill>, <à remplir>, and similar placeholders with appropriate clinical findings
- Base your findings on the indication text above
- Fill EVERY section - leave NO placeholders unfilled
- Use professional medical terminology
- Output plain text only (no markdown, no code blocks, no backticks)
- Write the whole report in {language_name}

TEMPLATE TO FOLLOW:

{skeleton}

Now generate the COMPLETE report with all placeholders filled:""";

    public static final String SIMILAR_CASES_HEADER = "\nSimilar Cases for Reference:\n";

    public static final String SIMILAR_CASE_LINE = "\n{index}. {preview}... (similarity: {score})\n";
}
