package com.openforge.docrouter.routing;

import com.openforge.docrouter.routing.dto.Attachment;

/** Antivirus or content scanner consulted before an attachment is scored. */
public interface SecurityScanner {

    ScanResult scan(Attachment attachment);

    record ScanResult(boolean clean, String threat) {

        public static ScanResult ok() {
            return new ScanResult(true, null);
        }

        public static ScanResult threat(String name) {
            return new ScanResult(false, name);
        }
    }
}
