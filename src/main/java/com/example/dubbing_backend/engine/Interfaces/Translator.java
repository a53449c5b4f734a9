package com.example.dubbing_backend.engine.Interfaces;

public interface Translator {
    String translate(String text, String sourceLang, String targetLang) throws Exception;
}
