package com.loglens.classification;

/**
 * Known-benign messages per input file. A candidate whose normalized message
 * is allow-listed is dropped before classification.
 */
public interface AllowListStore {
    
    AllowListStore NONE = (sourceFile, message) -> false;
    
    boolean isAllowListed(String sourceFile, String message);
}
