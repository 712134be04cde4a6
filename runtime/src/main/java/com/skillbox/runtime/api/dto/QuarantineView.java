package com.skillbox.runtime.api.dto;

import com.skillbox.runtime.gate.QuarantineRecord;

import java.util.List;

public record QuarantineView(String skillId, String timestamp, String directory, List<String> reasons) {

    public static QuarantineView from(QuarantineRecord r) {
        return new QuarantineView(r.skillId(), r.timestamp(), r.directory().toString(), r.reasons());
    }
}
