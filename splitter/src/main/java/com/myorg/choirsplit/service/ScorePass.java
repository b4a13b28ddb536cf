package com.myorg.choirsplit.service;

/**
 * One step of the split run. Passes read and rewrite the document held by the context
 * and record what they learned there for later passes.
 */
public interface ScorePass {

    String name();

    void apply(TransformationContext context);
}
