package com.example.revisiondiff.application;

public interface PatchRenderer {
    String render(String name, String original, String revised, int contextSize);
}
