package com.openforge.gazetranslate.error;

public class FragmentNotFoundException extends GazeTranslateException {

    public FragmentNotFoundException(String ownerId, Long fragmentId) {
        super(ErrorCode.NOT_FOUND,
                "Fragment %d not found for owner %s".formatted(fragmentId, ownerId));
    }
}
