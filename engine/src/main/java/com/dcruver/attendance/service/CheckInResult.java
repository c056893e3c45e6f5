package com.dcruver.attendance.service;

import com.dcruver.attendance.ledger.MarkResult;
import com.dcruver.attendance.matcher.MatchResult;
import lombok.Value;

/**
 * Recognition followed by an automatic mark. {@code mark} is null when the face was unknown.
 */
@Value
public class CheckInResult {
    MatchResult match;
    MarkResult mark;

    public boolean isMarked() {
        return mark != null && mark.isSuccess();
    }
}
