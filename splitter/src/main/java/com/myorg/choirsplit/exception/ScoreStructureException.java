package com.myorg.choirsplit.exception;

import lombok.Getter;

/**
 * Raised when the score tree lacks a node the pipeline cannot work without.
 * The run is aborted; {@link #getNodePath()} names the missing node.
 */
@Getter
public class ScoreStructureException extends RuntimeException {

    private final String nodePath;

    public ScoreStructureException(String nodePath, String message) {
        super(message + " (missing " + nodePath + ")");
        this.nodePath = nodePath;
    }

    public ScoreStructureException(String nodePath, String message, Throwable cause) {
        super(message + " (missing " + nodePath + ")", cause);
        this.nodePath = nodePath;
    }
}
