package com.ssau.aips.pipeline.service;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.ssau.aips.pipeline.config.PipelineConfig;
import com.ssau.aips.pipeline.model.Detection;
import com.ssau.aips.pipeline.model.ForbiddenItem;
import com.ssau.aips.pipeline.model.ObjectSignal;
import com.ssau.aips.pipeline.model.RoiWindow;

@Slf4j
public class ObjectSignalFilter {

    public ObjectSignal filter(List<Detection> detections, RoiWindow roi, PipelineConfig config) {
        if (detections == null || detections.isEmpty()) {
            return ObjectSignal.empty();
        }

        int persons = 0;
        List<ForbiddenItem> forbidden = new ArrayList<>();
        List<Detection> mapped = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            Detection full = new Detection(detection.classId(), detection.className(), detection.confidence(),
                roi.toFullFrame(detection.bbox()));
            mapped.add(full);

            if (isPerson(full, config)) {
                if (full.confidence() >= config.getPersonConfidence()) {
                    persons++;
                }
                continue;
            }
            String label = forbiddenLabel(full, config);
            if (label != null && full.confidence() >= config.getForbiddenConfidence()) {
                forbidden.add(new ForbiddenItem(label, full.confidence(), full.bbox()));
            }
        }

        if (!forbidden.isEmpty()) {
            log.debug("Forbidden items in frame: {}", forbidden);
        }
        return new ObjectSignal(persons, forbidden, mapped);
    }

    // a class name wins when the detector reports one, otherwise the numeric id decides
    private static boolean isPerson(Detection detection, PipelineConfig config) {
        if (detection.className() != null) {
            return config.getPersonClass().equals(detection.className());
        }
        return detection.classId() == config.getPersonClassId();
    }

    private static String forbiddenLabel(Detection detection, PipelineConfig config) {
        if (detection.className() != null) {
            return config.getForbiddenClasses().get(detection.className());
        }
        return config.getForbiddenClassIds().get(detection.classId());
    }
}
