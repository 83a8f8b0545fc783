package org.boxfit.exception;

import org.boxfit.model.enums.ErrorKind;
import lombok.Getter;

@Getter
public class BoxfitException extends RuntimeException {

    private final BoxfitError error;

    public BoxfitException(BoxfitError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ErrorKind getKind() {
        return error.getKind();
    }
}
