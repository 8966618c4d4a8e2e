package com.loglens.pipeline;

/**
 * Switches for the optional detectors.
 */
public class DetectionSettings {
    
    private boolean floodEnabled = true;
    private boolean spamEnabled = true;
    private boolean lofEnabled = true;
    private boolean behavioralEnabled = true;
    
    public boolean isFloodEnabled() {
        return floodEnabled;
    }
    
    public DetectionSettings setFloodEnabled(boolean floodEnabled) {
        this.floodEnabled = floodEnabled;
        return this;
    }
    
    public boolean isSpamEnabled() {
        return spamEnabled;
    }
    
    public DetectionSettings setSpamEnabled(boolean spamEnabled) {
        this.spamEnabled = spamEnabled;
        return this;
    }
    
    public boolean isLofEnabled() {
        return lofEnabled;
    }
    
    public DetectionSettings setLofEnabled(boolean lofEnabled) {
        this.lofEnabled = lofEnabled;
        return this;
    }
    
    public boolean isBehavioralEnabled() {
        return behavioralEnabled;
    }
    
    public DetectionSettings setBehavioralEnabled(boolean behavioralEnabled) {
        this.behavioralEnabled = behavioralEnabled;
        return this;
    }
}
