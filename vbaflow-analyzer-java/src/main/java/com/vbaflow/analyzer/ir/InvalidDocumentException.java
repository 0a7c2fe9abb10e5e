package com.vbaflow.analyzer.ir;

/**
 * A CFG document handed to the renderer (or read from disk) is missing or malformed.
 */
public class InvalidDocumentException extends RuntimeException {
    public InvalidDocumentException(String message) { super(message); }
    public InvalidDocumentException(String message, Throwable cause) { super(message, cause); }
}
