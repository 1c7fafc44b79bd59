package com.example.revisiondiff.application;

import com.example.revisiondiff.domain.DiffSegment;

import java.util.List;

public interface DiffRenderer {
    String render(List<DiffSegment> segments);
}
