package com.phillippitts.tagprobe.exception;

import com.phillippitts.tagprobe.domain.FileType;

/**
 * Thrown when identification recognised the outer container but failed further in.
 * Carries the best-guess container type so callers can log a diagnosis without
 * reporting the stream as unknown.
 */
public class ContainerIdentificationException extends TagProbeException {

    private final FileType bestGuess;

    public ContainerIdentificationException(FileType bestGuess, Throwable cause) {
        super("Identification failed inside " + bestGuess + " container: " + cause.getMessage(), cause);
        this.bestGuess = bestGuess;
    }

    public ContainerIdentificationException(FileType bestGuess, String message) {
        super(message);
        this.bestGuess = bestGuess;
    }

    public FileType getBestGuess() {
        return bestGuess;
    }
}
