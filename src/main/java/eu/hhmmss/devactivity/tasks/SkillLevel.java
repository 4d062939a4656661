package eu.hhmmss.devactivity.tasks;

/**
 * Minimum seniority needed for a task, as judged by an estimator.
 */
public enum SkillLevel {
    JUNIOR,
    MIDDLE,
    SENIOR,
    ARCHITECT
}
