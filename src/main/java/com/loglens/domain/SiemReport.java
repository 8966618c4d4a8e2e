package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured security and operational report for one analysed batch.
 * 
 * The report is assembled once by the report builder and then only read,
 * serialized to the summary JSON file or returned over HTTP. Section and field
 * names follow the snake_case layout consumers of the summary file expect.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SiemReport {
    
    @JsonProperty("siem_report")
    private Header header = new Header();
    
    @JsonProperty("security_assessment")
    private SecurityAssessment securityAssessment = new SecurityAssessment();
    
    @JsonProperty("operational_metrics")
    private OperationalMetrics operationalMetrics = new OperationalMetrics();
    
    @JsonProperty("technical_analysis")
    private TechnicalAnalysis technicalAnalysis = new TechnicalAnalysis();
    
    @JsonProperty("report_outputs")
    private ReportOutputs reportOutputs = new ReportOutputs();
    
    public Header getHeader() {
        return header;
    }
    
    public void setHeader(Header header) {
        this.header = header;
    }
    
    public SecurityAssessment getSecurityAssessment() {
        return securityAssessment;
    }
    
    public void setSecurityAssessment(SecurityAssessment securityAssessment) {
        this.securityAssessment = securityAssessment;
    }
    
    public OperationalMetrics getOperationalMetrics() {
        return operationalMetrics;
    }
    
    public void setOperationalMetrics(OperationalMetrics operationalMetrics) {
        this.operationalMetrics = operationalMetrics;
    }
    
    public TechnicalAnalysis getTechnicalAnalysis() {
        return technicalAnalysis;
    }
    
    public void setTechnicalAnalysis(TechnicalAnalysis technicalAnalysis) {
        this.technicalAnalysis = technicalAnalysis;
    }
    
    public ReportOutputs getReportOutputs() {
        return reportOutputs;
    }
    
    public void setReportOutputs(ReportOutputs reportOutputs) {
        this.reportOutputs = reportOutputs;
    }
    
    // ========== siem_report ==========
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Header {
        @JsonProperty("report_timestamp")
        private String reportTimestamp;
        
        @JsonProperty("source_file")
        private String sourceFile;
        
        @JsonProperty("risk_level")
        private RiskLevel riskLevel = RiskLevel.LOW;
        
        @JsonProperty("security_incidents")
        private long securityIncidents;
        
        @JsonProperty("critical_anomalies")
        private long criticalAnomalies;
        
        @JsonProperty("threat_indicators")
        private List<ThreatIndicator> threatIndicators = new ArrayList<>();
        
        @JsonProperty("analysis_period")
        private AnalysisPeriod analysisPeriod;
        
        public String getReportTimestamp() {
            return reportTimestamp;
        }
        
        public void setReportTimestamp(String reportTimestamp) {
            this.reportTimestamp = reportTimestamp;
        }
        
        public String getSourceFile() {
            return sourceFile;
        }
        
        public void setSourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
        }
        
        public RiskLevel getRiskLevel() {
            return riskLevel;
        }
        
        public void setRiskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
        }
        
        public long getSecurityIncidents() {
            return securityIncidents;
        }
        
        public void setSecurityIncidents(long securityIncidents) {
            this.securityIncidents = securityIncidents;
        }
        
        public long getCriticalAnomalies() {
            return criticalAnomalies;
        }
        
        public void setCriticalAnomalies(long criticalAnomalies) {
            this.criticalAnomalies = criticalAnomalies;
        }
        
        public List<ThreatIndicator> getThreatIndicators() {
            return threatIndicators;
        }
        
        public void setThreatIndicators(List<ThreatIndicator> threatIndicators) {
            this.threatIndicators = threatIndicators;
        }
        
        public AnalysisPeriod getAnalysisPeriod() {
            return analysisPeriod;
        }
        
        public void setAnalysisPeriod(AnalysisPeriod analysisPeriod) {
            this.analysisPeriod = analysisPeriod;
        }
    }
    
    public static class AnalysisPeriod {
        @JsonProperty("start")
        private String start;
        
        @JsonProperty("end")
        private String end;
        
        @JsonProperty("duration_hours")
        private double durationHours;
        
        public AnalysisPeriod() {
        }
        
        public AnalysisPeriod(String start, String end, double durationHours) {
            this.start = start;
            this.end = end;
            this.durationHours = durationHours;
        }
        
        public String getStart() {
            return start;
        }
        
        public String getEnd() {
            return end;
        }
        
        public double getDurationHours() {
            return durationHours;
        }
    }
    
    // ========== security_assessment ==========
    
    public static class SecurityAssessment {
        @JsonProperty("data_exposure")
        private DataExposure dataExposure = new DataExposure();
        
        @JsonProperty("rule_based_violations")
        private RuleViolations ruleBasedViolations = new RuleViolations();
        
        @JsonProperty("anomalous_behavior")
        private AnomalousBehavior anomalousBehavior = new AnomalousBehavior();
        
        public DataExposure getDataExposure() {
            return dataExposure;
        }
        
        public RuleViolations getRuleBasedViolations() {
            return ruleBasedViolations;
        }
        
        public AnomalousBehavior getAnomalousBehavior() {
            return anomalousBehavior;
        }
    }
    
    public static class DataExposure {
        @JsonProperty("sensitive_leaks")
        private int sensitiveLeaks;
        
        @JsonProperty("details")
        private List<SecurityLeak> details = new ArrayList<>();
        
        public int getSensitiveLeaks() {
            return sensitiveLeaks;
        }
        
        public List<SecurityLeak> getDetails() {
            return details;
        }
        
        public void setDetails(List<SecurityLeak> details) {
            this.details = details;
            this.sensitiveLeaks = details.size();
        }
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SecurityLeak {
        @JsonProperty("index")
        private int index;
        
        @JsonProperty("timestamp")
        private String timestamp;
        
        @JsonProperty("message")
        private String message;
        
        @JsonProperty("reason")
        private String reason;
        
        @JsonProperty("type")
        private String type;
        
        public SecurityLeak() {
        }
        
        public SecurityLeak(int index, String timestamp, String message, String reason, String type) {
            this.index = index;
            this.timestamp = timestamp;
            this.message = message;
            this.reason = reason;
            this.type = type;
        }
        
        public int getIndex() {
            return index;
        }
        
        public String getTimestamp() {
            return timestamp;
        }
        
        public String getMessage() {
            return message;
        }
        
        public String getReason() {
            return reason;
        }
        
        public String getType() {
            return type;
        }
    }
    
    public static class RuleViolations {
        @JsonProperty("count")
        private int count;
        
        @JsonProperty("severity")
        private String severity = "LOW";
        
        @JsonProperty("by_pattern")
        private Map<String, Integer> byPattern = new LinkedHashMap<>();
        
        public int getCount() {
            return count;
        }
        
        public void setCount(int count) {
            this.count = count;
        }
        
        public String getSeverity() {
            return severity;
        }
        
        public void setSeverity(String severity) {
            this.severity = severity;
        }
        
        public Map<String, Integer> getByPattern() {
            return byPattern;
        }
        
        public void setByPattern(Map<String, Integer> byPattern) {
            this.byPattern = byPattern;
        }
    }
    
    public static class AnomalousBehavior {
        @JsonProperty("statistical_anomalies")
        private int statisticalAnomalies;
        
        @JsonProperty("density_anomalies")
        private int densityAnomalies;
        
        @JsonProperty("behavioral_anomalies")
        private int behavioralAnomalies;
        
        @JsonProperty("flood_anomalies")
        private int floodAnomalies;
        
        @JsonProperty("ai_verified_threats")
        private int aiVerifiedThreats;
        
        @JsonProperty("false_positives_filtered")
        private int falsePositivesFiltered;
        
        public int getStatisticalAnomalies() {
            return statisticalAnomalies;
        }
        
        public void setStatisticalAnomalies(int statisticalAnomalies) {
            this.statisticalAnomalies = statisticalAnomalies;
        }
        
        public int getDensityAnomalies() {
            return densityAnomalies;
        }
        
        public void setDensityAnomalies(int densityAnomalies) {
            this.densityAnomalies = densityAnomalies;
        }
        
        public int getBehavioralAnomalies() {
            return behavioralAnomalies;
        }
        
        public void setBehavioralAnomalies(int behavioralAnomalies) {
            this.behavioralAnomalies = behavioralAnomalies;
        }
        
        public int getFloodAnomalies() {
            return floodAnomalies;
        }
        
        public void setFloodAnomalies(int floodAnomalies) {
            this.floodAnomalies = floodAnomalies;
        }
        
        public int getAiVerifiedThreats() {
            return aiVerifiedThreats;
        }
        
        public void setAiVerifiedThreats(int aiVerifiedThreats) {
            this.aiVerifiedThreats = aiVerifiedThreats;
        }
        
        public int getFalsePositivesFiltered() {
            return falsePositivesFiltered;
        }
        
        public void setFalsePositivesFiltered(int falsePositivesFiltered) {
            this.falsePositivesFiltered = falsePositivesFiltered;
        }
    }
    
    // ========== operational_metrics ==========
    
    public static class OperationalMetrics {
        @JsonProperty("log_volume")
        private LogVolume logVolume = new LogVolume();
        
        @JsonProperty("system_health")
        private SystemHealth systemHealth = new SystemHealth();
        
        @JsonProperty("component_analysis")
        private ComponentAnalysis componentAnalysis = new ComponentAnalysis();
        
        public LogVolume getLogVolume() {
            return logVolume;
        }
        
        public SystemHealth getSystemHealth() {
            return systemHealth;
        }
        
        public ComponentAnalysis getComponentAnalysis() {
            return componentAnalysis;
        }
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LogVolume {
        @JsonProperty("total_logs")
        private int totalLogs;
        
        @JsonProperty("logs_after_flood_collapse")
        private int logsAfterFloodCollapse;
        
        @JsonProperty("time_metrics")
        private TimeMetrics timeMetrics;
        
        public int getTotalLogs() {
            return totalLogs;
        }
        
        public void setTotalLogs(int totalLogs) {
            this.totalLogs = totalLogs;
        }
        
        public int getLogsAfterFloodCollapse() {
            return logsAfterFloodCollapse;
        }
        
        public void setLogsAfterFloodCollapse(int logsAfterFloodCollapse) {
            this.logsAfterFloodCollapse = logsAfterFloodCollapse;
        }
        
        public TimeMetrics getTimeMetrics() {
            return timeMetrics;
        }
        
        public void setTimeMetrics(TimeMetrics timeMetrics) {
            this.timeMetrics = timeMetrics;
        }
    }
    
    public static class TimeMetrics {
        @JsonProperty("start_time")
        private String startTime;
        
        @JsonProperty("end_time")
        private String endTime;
        
        @JsonProperty("time_span_seconds")
        private double timeSpanSeconds;
        
        @JsonProperty("logs_per_second")
        private double logsPerSecond;
        
        @JsonProperty("logs_per_minute")
        private double logsPerMinute;
        
        @JsonProperty("logs_per_hour")
        private double logsPerHour;
        
        @JsonProperty("peak_logs_per_minute")
        private long peakLogsPerMinute;
        
        @JsonProperty("error_rate")
        private double errorRate;
        
        public String getStartTime() {
            return startTime;
        }
        
        public void setStartTime(String startTime) {
            this.startTime = startTime;
        }
        
        public String getEndTime() {
            return endTime;
        }
        
        public void setEndTime(String endTime) {
            this.endTime = endTime;
        }
        
        public double getTimeSpanSeconds() {
            return timeSpanSeconds;
        }
        
        public void setTimeSpanSeconds(double timeSpanSeconds) {
            this.timeSpanSeconds = timeSpanSeconds;
        }
        
        public double getLogsPerSecond() {
            return logsPerSecond;
        }
        
        public void setLogsPerSecond(double logsPerSecond) {
            this.logsPerSecond = logsPerSecond;
        }
        
        public double getLogsPerMinute() {
            return logsPerMinute;
        }
        
        public void setLogsPerMinute(double logsPerMinute) {
            this.logsPerMinute = logsPerMinute;
        }
        
        public double getLogsPerHour() {
            return logsPerHour;
        }
        
        public void setLogsPerHour(double logsPerHour) {
            this.logsPerHour = logsPerHour;
        }
        
        public long getPeakLogsPerMinute() {
            return peakLogsPerMinute;
        }
        
        public void setPeakLogsPerMinute(long peakLogsPerMinute) {
            this.peakLogsPerMinute = peakLogsPerMinute;
        }
        
        public double getErrorRate() {
            return errorRate;
        }
        
        public void setErrorRate(double errorRate) {
            this.errorRate = errorRate;
        }
    }
    
    public static class SystemHealth {
        @JsonProperty("log_levels")
        private Map<String, Long> logLevels = new LinkedHashMap<>();
        
        @JsonProperty("error_rate")
        private double errorRate;
        
        @JsonProperty("flood_detection")
        private FloodDetection floodDetection = new FloodDetection();
        
        public Map<String, Long> getLogLevels() {
            return logLevels;
        }
        
        public void setLogLevels(Map<String, Long> logLevels) {
            this.logLevels = logLevels;
        }
        
        public double getErrorRate() {
            return errorRate;
        }
        
        public void setErrorRate(double errorRate) {
            this.errorRate = errorRate;
        }
        
        public FloodDetection getFloodDetection() {
            return floodDetection;
        }
    }
    
    public static class FloodDetection {
        @JsonProperty("detected")
        private boolean detected;
        
        @JsonProperty("summary_count")
        private int summaryCount;
        
        @JsonProperty("records_collapsed")
        private int recordsCollapsed;
        
        public boolean isDetected() {
            return detected;
        }
        
        public void setDetected(boolean detected) {
            this.detected = detected;
        }
        
        public int getSummaryCount() {
            return summaryCount;
        }
        
        public void setSummaryCount(int summaryCount) {
            this.summaryCount = summaryCount;
        }
        
        public int getRecordsCollapsed() {
            return recordsCollapsed;
        }
        
        public void setRecordsCollapsed(int recordsCollapsed) {
            this.recordsCollapsed = recordsCollapsed;
        }
    }
    
    public static class ComponentAnalysis {
        @JsonProperty("unique_components")
        private int uniqueComponents;
        
        @JsonProperty("top_components")
        private Map<String, Long> topComponents = new LinkedHashMap<>();
        
        public int getUniqueComponents() {
            return uniqueComponents;
        }
        
        public void setUniqueComponents(int uniqueComponents) {
            this.uniqueComponents = uniqueComponents;
        }
        
        public Map<String, Long> getTopComponents() {
            return topComponents;
        }
        
        public void setTopComponents(Map<String, Long> topComponents) {
            this.topComponents = topComponents;
        }
    }
    
    // ========== technical_analysis ==========
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class TechnicalAnalysis {
        @JsonProperty("template_diversity")
        private TemplateDiversity templateDiversity = new TemplateDiversity();
        
        @JsonProperty("top_patterns")
        private List<TemplateCount> topPatterns = new ArrayList<>();
        
        @JsonProperty("flood_summaries")
        private List<FloodSummary> floodSummaries = new ArrayList<>();
        
        @JsonProperty("global_flood_templates")
        private List<String> globalFloodTemplates = new ArrayList<>();
        
        @JsonProperty("behavioral_detection")
        private BehavioralDetection behavioralDetection = new BehavioralDetection();
        
        @JsonProperty("ai_analysis")
        private AiAnalysis aiAnalysis;
        
        @JsonProperty("tag_summary")
        private Map<String, Integer> tagSummary = new LinkedHashMap<>();
        
        public TemplateDiversity getTemplateDiversity() {
            return templateDiversity;
        }
        
        public List<TemplateCount> getTopPatterns() {
            return topPatterns;
        }
        
        public void setTopPatterns(List<TemplateCount> topPatterns) {
            this.topPatterns = topPatterns;
        }
        
        public List<FloodSummary> getFloodSummaries() {
            return floodSummaries;
        }
        
        public void setFloodSummaries(List<FloodSummary> floodSummaries) {
            this.floodSummaries = floodSummaries;
        }
        
        public List<String> getGlobalFloodTemplates() {
            return globalFloodTemplates;
        }
        
        public void setGlobalFloodTemplates(List<String> globalFloodTemplates) {
            this.globalFloodTemplates = globalFloodTemplates;
        }
        
        public BehavioralDetection getBehavioralDetection() {
            return behavioralDetection;
        }
        
        public AiAnalysis getAiAnalysis() {
            return aiAnalysis;
        }
        
        public void setAiAnalysis(AiAnalysis aiAnalysis) {
            this.aiAnalysis = aiAnalysis;
        }
        
        public Map<String, Integer> getTagSummary() {
            return tagSummary;
        }
        
        public void setTagSummary(Map<String, Integer> tagSummary) {
            this.tagSummary = tagSummary;
        }
    }
    
    public static class TemplateDiversity {
        @JsonProperty("unique_templates")
        private int uniqueTemplates;
        
        @JsonProperty("entropy")
        private double entropy;
        
        @JsonProperty("top_template_ratio")
        private double topTemplateRatio;
        
        public int getUniqueTemplates() {
            return uniqueTemplates;
        }
        
        public void setUniqueTemplates(int uniqueTemplates) {
            this.uniqueTemplates = uniqueTemplates;
        }
        
        public double getEntropy() {
            return entropy;
        }
        
        public void setEntropy(double entropy) {
            this.entropy = entropy;
        }
        
        public double getTopTemplateRatio() {
            return topTemplateRatio;
        }
        
        public void setTopTemplateRatio(double topTemplateRatio) {
            this.topTemplateRatio = topTemplateRatio;
        }
    }
    
    public static class TemplateCount {
        @JsonProperty("template")
        private String template;
        
        @JsonProperty("count")
        private long count;
        
        @JsonProperty("ratio")
        private double ratio;
        
        public TemplateCount() {
        }
        
        public TemplateCount(String template, long count, double ratio) {
            this.template = template;
            this.count = count;
            this.ratio = ratio;
        }
        
        public String getTemplate() {
            return template;
        }
        
        public long getCount() {
            return count;
        }
        
        public double getRatio() {
            return ratio;
        }
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BehavioralDetection {
        @JsonProperty("enabled")
        private boolean enabled;
        
        @JsonProperty("rules_evaluated")
        private int rulesEvaluated;
        
        @JsonProperty("skipped_reason")
        private String skippedReason;
        
        @JsonProperty("anomalies")
        private List<BehavioralAnomaly> anomalies = new ArrayList<>();
        
        public boolean isEnabled() {
            return enabled;
        }
        
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
        
        public int getRulesEvaluated() {
            return rulesEvaluated;
        }
        
        public void setRulesEvaluated(int rulesEvaluated) {
            this.rulesEvaluated = rulesEvaluated;
        }
        
        public String getSkippedReason() {
            return skippedReason;
        }
        
        public void setSkippedReason(String skippedReason) {
            this.skippedReason = skippedReason;
        }
        
        public List<BehavioralAnomaly> getAnomalies() {
            return anomalies;
        }
        
        public void setAnomalies(List<BehavioralAnomaly> anomalies) {
            this.anomalies = anomalies;
        }
    }
    
    public static class AiAnalysis {
        @JsonProperty("provider")
        private String provider;
        
        @JsonProperty("model")
        private String model;
        
        @JsonProperty("candidates_classified")
        private int candidatesClassified;
        
        @JsonProperty("total_calls")
        private long totalCalls;
        
        @JsonProperty("total_elapsed_ms")
        private long totalElapsedMs;
        
        @JsonProperty("average_latency_ms")
        private double averageLatencyMs;
        
        @JsonProperty("errors")
        private long errors;
        
        @JsonProperty("tokens_used")
        private long tokensUsed;
        
        @JsonProperty("contexts_trimmed")
        private long contextsTrimmed;
        
        public String getProvider() {
            return provider;
        }
        
        public void setProvider(String provider) {
            this.provider = provider;
        }
        
        public String getModel() {
            return model;
        }
        
        public void setModel(String model) {
            this.model = model;
        }
        
        public int getCandidatesClassified() {
            return candidatesClassified;
        }
        
        public void setCandidatesClassified(int candidatesClassified) {
            this.candidatesClassified = candidatesClassified;
        }
        
        public long getTotalCalls() {
            return totalCalls;
        }
        
        public void setTotalCalls(long totalCalls) {
            this.totalCalls = totalCalls;
        }
        
        public long getTotalElapsedMs() {
            return totalElapsedMs;
        }
        
        public void setTotalElapsedMs(long totalElapsedMs) {
            this.totalElapsedMs = totalElapsedMs;
        }
        
        public double getAverageLatencyMs() {
            return averageLatencyMs;
        }
        
        public void setAverageLatencyMs(double averageLatencyMs) {
            this.averageLatencyMs = averageLatencyMs;
        }
        
        public long getErrors() {
            return errors;
        }
        
        public void setErrors(long errors) {
            this.errors = errors;
        }
        
        public long getTokensUsed() {
            return tokensUsed;
        }
        
        public void setTokensUsed(long tokensUsed) {
            this.tokensUsed = tokensUsed;
        }
        
        public long getContextsTrimmed() {
            return contextsTrimmed;
        }
        
        public void setContextsTrimmed(long contextsTrimmed) {
            this.contextsTrimmed = contextsTrimmed;
        }
    }
    
    // ========== report_outputs ==========
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ReportOutputs {
        @JsonProperty("summary_file")
        private String summaryFile;
        
        @JsonProperty("anomalies_file")
        private String anomaliesFile;
        
        @JsonProperty("anomaly_count")
        private int anomalyCount;
        
        @JsonProperty("llm_candidates_file")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private String candidatesFile;
        
        public String getSummaryFile() {
            return summaryFile;
        }
        
        public void setSummaryFile(String summaryFile) {
            this.summaryFile = summaryFile;
        }
        
        public String getAnomaliesFile() {
            return anomaliesFile;
        }
        
        public void setAnomaliesFile(String anomaliesFile) {
            this.anomaliesFile = anomaliesFile;
        }
        
        public int getAnomalyCount() {
            return anomalyCount;
        }
        
        public void setAnomalyCount(int anomalyCount) {
            this.anomalyCount = anomalyCount;
        }
        
        public String getCandidatesFile() {
            return candidatesFile;
        }
        
        public void setCandidatesFile(String candidatesFile) {
            this.candidatesFile = candidatesFile;
        }
    }
}
