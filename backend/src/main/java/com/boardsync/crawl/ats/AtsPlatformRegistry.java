package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.AtsType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class AtsPlatformRegistry {
    private final AtsDetector detector;
    private final Map<AtsType, AtsPlatform> platforms = new EnumMap<>(AtsType.class);

    public AtsPlatformRegistry(AtsDetector detector, List<AtsPlatform> platforms) {
        this.detector = detector;
        for (AtsPlatform platform : platforms) {
            this.platforms.put(platform.type(), platform);
        }
        for (AtsType type : AtsType.values()) {
            if (!this.platforms.containsKey(type)) {
                throw new IllegalStateException("No platform registered for " + type);
            }
        }
    }

    public AtsPlatform forType(AtsType type) {
        return platforms.get(type == null ? AtsType.GENERIC : type);
    }

    public AtsPlatform forPage(String url, String html) {
        return forType(detector.detect(url, html));
    }
}
