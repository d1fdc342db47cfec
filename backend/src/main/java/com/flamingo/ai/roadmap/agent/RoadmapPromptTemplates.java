package com.flamingo.ai.roadmap.agent;

import dev.langchain4j.model.input.PromptTemplate;

/**
 * Prompt templates for batched roadmap generation. Variables use LangChain4j's {@code {{name}}}
 * syntax and are filled by {@code BatchPromptComposer}.
 */
public final class RoadmapPromptTemplates {

  /** Sent once when the session is opened. */
  public static final PromptTemplate SYSTEM =
      PromptTemplate.from(
          """
            You are an expert career mentor and technical educator.
            You build practical, week-by-week learning roadmaps for someone aspiring to become
            a {{targetRole}}. The roadmap is produced in several parts; each request names the
            weeks to produce next and you keep everything consistent with the weeks you already
            wrote in this conversation.

            Rules:
            - Return ONLY valid JSON, no explanations and no markdown
            - Produce exactly the weeks requested, numbered as requested
            - Never repeat a week that was already produced
            - Use real learning resources (official documentation, freeCodeCamp, MDN,
              W3Schools, well known GitHub repositories) with real URLs
            """);

  /** Requests one batch of weeks. */
  public static final PromptTemplate BATCH =
      PromptTemplate.from(
          """
            Generate weeks {{startWeek}} to {{endWeek}} ({{weekCount}} of {{totalWeeks}} weeks)
            of the learning roadmap for becoming a {{targetRole}}.

            ## Learner profile
            - Experience level: {{experienceLevel}}
            - Preferred learning style: {{learningStyle}}
            - Daily learning time: {{dailyMinutes}} minutes
            - Current readiness: {{readiness}}%

            ## Skills to master
            {{missingSkills}}

            ## Skills to improve
            {{skillsToImprove}}

            ## Where the previous part ended
            {{context}}

            ## Requirements
            - {{phaseGuidance}}
            - Each week has {{daysPerWeek}} days with {{minTasks}} to {{maxTasks}} tasks per day
            - Each task takes {{minTaskMinutes}} to {{dailyMinutes}} minutes
            - task_type is one of: reading, practice, project, review
            - difficulty is an integer from 1 to 5
            - At most 3 resources per task
            - At most one milestone per part, placed in one of these weeks
            {{headerInstruction}}

            Return this JSON structure:
            {
              {{headerFields}}"weeks": [
                {
                  "week_number": {{startWeek}},
                  "focus_area": "Topic of the week",
                  "learning_objectives": ["objective1", "objective2"],
                  "days": [
                    {
                      "day_number": 1,
                      "tasks": [
                        {
                          "title": "Specific task title",
                          "description": "What to learn and why it matters for a {{targetRole}}",
                          "task_type": "reading",
                          "estimated_duration": {{minTaskMinutes}},
                          "difficulty": 2,
                          "learning_objectives": ["objective1"],
                          "success_criteria": "You can explain X and do Y",
                          "prerequisites": [],
                          "resources": [
                            {"title": "Resource name", "url": "https://example.org", "type": "documentation"}
                          ]
                        }
                      ]
                    }
                  ]
                }
              ],
              "milestones": [
                {
                  "week_number": {{endWeek}},
                  "title": "Milestone title",
                  "description": "What the learner builds",
                  "skills_demonstrated": ["skill1"],
                  "deliverable": "Working project"
                }
              ]
            }
            """);

  /** Corrective follow-up when the previous reply could not be parsed. */
  public static final PromptTemplate REPAIR =
      PromptTemplate.from(
          """
            Your previous reply for weeks {{startWeek}} to {{endWeek}} could not be used: {{problem}}.
            Reply again with ONLY the JSON object for weeks {{startWeek}} to {{endWeek}}, using
            the structure requested before. Keep it compact: shorter descriptions, at most
            {{maxTasks}} tasks per day. No markdown and no text outside the JSON.
            """);

  private RoadmapPromptTemplates() {}
}
