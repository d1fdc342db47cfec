package com.flamingo.ai.roadmap.service.generation.fallback;

import com.flamingo.ai.roadmap.domain.model.RoleContext;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Default skill lists per role family, used when the skill-gap analysis has nothing to offer. */
@Component
public class RoleSkillCatalog {

  private static final Map<String, List<String>> SKILLS_BY_ROLE_KEYWORD = new LinkedHashMap<>();

  static {
    SKILLS_BY_ROLE_KEYWORD.put(
        "frontend",
        List.of("HTML", "CSS", "JavaScript", "React", "TypeScript", "Responsive Design", "Git"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "backend",
        List.of("Python", "Node.js", "Databases", "REST APIs", "SQL", "Authentication", "Git"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "fullstack",
        List.of(
            "HTML/CSS",
            "JavaScript",
            "React",
            "Node.js",
            "Databases",
            "REST APIs",
            "Git",
            "Deployment"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "data scientist",
        List.of(
            "Python",
            "Pandas",
            "NumPy",
            "Machine Learning",
            "SQL",
            "Data Visualization",
            "Statistics"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "data analyst",
        List.of("SQL", "Excel", "Python", "Data Visualization", "Statistics", "Tableau/PowerBI"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "devops",
        List.of("Linux", "Docker", "Kubernetes", "CI/CD", "AWS/Azure", "Terraform", "Scripting"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "machine learning",
        List.of(
            "Python",
            "TensorFlow/PyTorch",
            "Mathematics",
            "Statistics",
            "Deep Learning",
            "Data Processing"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "mobile",
        List.of(
            "React Native",
            "Flutter",
            "iOS/Android",
            "Mobile UI/UX",
            "APIs",
            "App Store Deployment"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "cloud", List.of("AWS", "Azure", "GCP", "Networking", "Security", "IaC", "Serverless"));
    SKILLS_BY_ROLE_KEYWORD.put(
        "cybersecurity",
        List.of(
            "Network Security",
            "Ethical Hacking",
            "Cryptography",
            "Security Tools",
            "Compliance",
            "Incident Response"));
  }

  private static final List<String> GENERIC_SKILLS =
      List.of(
          "Programming Fundamentals",
          "Problem Solving",
          "Git Version Control",
          "Documentation",
          "Best Practices",
          "Testing");

  /** Skills for a role name, matched on the first keyword it contains. */
  public List<String> defaultSkillsFor(String targetRole) {
    if (targetRole == null) {
      return GENERIC_SKILLS;
    }
    String role = targetRole.toLowerCase(Locale.ROOT).replace("full stack", "fullstack");
    return SKILLS_BY_ROLE_KEYWORD.entrySet().stream()
        .filter(entry -> role.contains(entry.getKey()))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(GENERIC_SKILLS);
  }

  /**
   * Skills to build a roadmap around: the analysed gaps first, then skills to improve, or the role
   * defaults when both are empty.
   */
  public List<String> skillsFor(RoleContext roleContext) {
    Set<String> skills = new LinkedHashSet<>();
    roleContext.missingSkills().stream().filter(s -> !s.isBlank()).forEach(skills::add);
    roleContext.skillsToImprove().stream().filter(s -> !s.isBlank()).forEach(skills::add);
    if (skills.isEmpty()) {
      return defaultSkillsFor(roleContext.targetRole());
    }
    return List.copyOf(skills);
  }
}
