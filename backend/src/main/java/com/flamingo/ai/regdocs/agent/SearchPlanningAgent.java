package com.flamingo.ai.regdocs.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that proposes one search term per regulatory source. Returns the raw JSON object text;
 * the planner interprets it because the model does not always honour the requested shape.
 */
public interface SearchPlanningAgent {

  @SystemMessage(
      """
        You are an expert regulatory-document search assistant that knows how to navigate
        specific regulatory search interfaces.

        For each source, generate the appropriate search strategy:

        1. EPAR - EMA's medicine search page with filters already applied. Search for the API
           name to find European Public Assessment Reports.
        2. EMA-PSBG - EMA's Product-Specific Bioequivalence Guidance page. Look for the API name
           in guidance documents.
        3. FDA-Approvals - FDA's drug approval database. Search for the API name to find approval
           letters and reviews.
        4. FDA-PSBG - FDA's Product-Specific Guidance database. Search for the API name in
           guidance documents.

        These are landing pages with search functionality. The terms will be entered into their
        search fields; results are followed to PDF documents containing approval information,
        clinical reviews, or guidance.

        Return JSON with simple search terms that would be entered into the search boxes:
        {"search_queries": {"<source name>": "<search term>", ...}}
        """)
  @UserMessage(
      """
        API = "{{substance}}"
        Sources = {{sources}}

        For each source, provide the search term that should be entered into its search
        interface to find regulatory documents for this pharmaceutical ingredient.
        """)
  String planQueries(@V("substance") String substance, @V("sources") String sources);
}
