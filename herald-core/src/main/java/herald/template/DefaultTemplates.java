package herald.template;

import java.util.List;
import java.util.Map;

/**
 * Built-in templates installed by {@link TemplateEngine#installDefaults()}.
 */
public final class DefaultTemplates {
  public static final String SYSTEM_ALERT = "system-alert";
  public static final String DEPLOYMENT_STATUS = "deployment-status";
  public static final String MONITORING_REPORT = "monitoring-report";
  public static final String BACKUP_STATUS = "backup-status";

  private DefaultTemplates() {
  }

  public static List<Template> all() {
    return List.of(
        Template.of(SYSTEM_ALERT,
            "System Alert: {{alert_type | default \"Unknown\"}}",
            "Alert Details:\n"
                + "- System: {{system | default \"Unknown\"}}\n"
                + "- Severity: {{severity | default \"Medium\"}}\n"
                + "- Message: {{message}}\n"
                + "- Timestamp: {{timestamp}}",
            Map.of("severity", "Medium", "alert_type", "System Alert"),
            "Template for system alerts and notifications"),
        Template.of(DEPLOYMENT_STATUS,
            "Deployment {{status | default \"Update\" | title}}",
            "Deployment Information:\n"
                + "- Application: {{app_name}}\n"
                + "- Version: {{version}}\n"
                + "- Environment: {{environment | default \"production\"}}\n"
                + "- Status: {{status}}\n"
                + "- Time: {{timestamp}}",
            Map.of("environment", "production", "status", "completed"),
            "Template for deployment status notifications"),
        Template.of(MONITORING_REPORT,
            "{{report_type | default \"Monitoring\"}} Report",
            "Report Summary:\n"
                + "- Period: {{period | default \"Last 24 hours\"}}\n"
                + "- Metrics: {{metrics}}\n"
                + "- Status: {{overall_status | default \"Normal\"}}\n"
                + "{{#if details}}- Details: {{details}}\n{{/if}}"
                + "- Generated: {{timestamp}}",
            Map.of("period", "Last 24 hours", "overall_status", "Normal"),
            "Template for monitoring and health reports"),
        Template.of(BACKUP_STATUS,
            "Backup {{status | default \"Completed\" | title}}",
            "Backup Details:\n"
                + "- Database: {{database}}\n"
                + "- Size: {{backup_size | default \"Unknown\"}}\n"
                + "- Duration: {{duration | default \"Unknown\"}}\n"
                + "- Status: {{status}}\n"
                + "{{#if backup_location}}- Location: {{backup_location}}\n{{/if}}"
                + "- Time: {{timestamp}}",
            Map.of("status", "completed", "backup_size", "Unknown", "duration", "Unknown"),
            "Template for database backup status notifications"));
  }
}
