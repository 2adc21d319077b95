package com.mouse.betinfo.model;

import com.mouse.betinfo.entity.Analysis;

import java.util.List;

/**
 * @param path     root first, the requested analysis last
 * @param children analyses that name the requested one as parent
 */
public record LineageView(Analysis analysis, List<Analysis> path, List<Analysis> children) {

    public int depth() {
        return path.size() - 1;
    }
}
