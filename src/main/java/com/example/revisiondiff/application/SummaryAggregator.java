package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.DiffSegment;
import com.example.revisiondiff.domain.DiffSummary;
import com.example.revisiondiff.domain.TextUnits;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class SummaryAggregator {

    public DiffSummary summarize(List<DiffSegment> segments) {
        int insertions = 0;
        int deletions = 0;
        int replacements = 0;
        int unchanged = 0;
        for (DiffSegment segment : segments) {
            switch (segment.type()) {
                case EQUAL -> unchanged += TextUnits.length(segment.original());
                case INSERT -> insertions += TextUnits.length(segment.modified());
                case DELETE -> deletions += TextUnits.length(segment.original());
                case REPLACE -> {
                    replacements++;
                    deletions += TextUnits.length(segment.original());
                    insertions += TextUnits.length(segment.modified());
                }
            }
        }
        return new DiffSummary(insertions, deletions, replacements, unchanged, insertions + deletions);
    }
}
