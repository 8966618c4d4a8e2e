package com.loglens.classification;

import com.loglens.domain.AnnotatedRecord;
import com.loglens.domain.DetectionAnnotation;

/**
 * Stack trace continuation lines the classifier could not place follow an
 * actual error; they are relabelled and stop counting as anomalies.
 */
public class DependentAnomalyFilter {
    
    public static final String DEPENDENT_ANOMALY = "Dependent Anomaly";
    static final String DEPENDENT_REASON = "Stack trace line, follows an actual error.";
    
    /**
     * @return true if the record was relabelled
     */
    public boolean apply(AnnotatedRecord record) {
        DetectionAnnotation annotation = record.getAnnotation();
        if (!ResponseParser.UNKNOWN.equals(annotation.getClassification())) {
            return false;
        }
        if (!record.getMessage().trim().startsWith("at ")) {
            return false;
        }
        annotation.setClassification(DEPENDENT_ANOMALY);
        annotation.setReason(DEPENDENT_REASON);
        annotation.clearAnomaly();
        return true;
    }
}
