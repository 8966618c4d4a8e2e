package com.loglens.rules;

import com.loglens.detection.behavioral.BehavioralRule;

import java.util.List;

/**
 * Source of additional patterns and behavioral rules supplied by operators.
 * An absent source yields empty lists.
 */
public interface CustomPatternSource {
    
    List<RulePattern> rulePatterns();
    
    List<RulePattern> securityPatterns();
    
    List<BehavioralRule> behavioralRules();
    
    CustomPatternSource EMPTY = new CustomPatternSource() {
        @Override
        public List<RulePattern> rulePatterns() {
            return List.of();
        }
        
        @Override
        public List<RulePattern> securityPatterns() {
            return List.of();
        }
        
        @Override
        public List<BehavioralRule> behavioralRules() {
            return List.of();
        }
    };
}
