/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import io.lspbridge.spec.LspSchema.Diagnostic;
import io.lspbridge.spec.LspSchema.PublishDiagnosticsParams;

/**
 * 按URI保存最近一次发布的诊断。每次发布整体替换该URI的诊断，空列表同样会替换。
 */
public class DiagnosticsBuffer {

	private final ConcurrentHashMap<String, List<Diagnostic>> diagnostics = new ConcurrentHashMap<>();

	public void accept(PublishDiagnosticsParams params) {
		this.diagnostics.put(params.uri(), params.diagnostics());
	}

	/**
	 * 当前所有诊断的快照，按URI排序。
	 */
	public Map<String, List<Diagnostic>> getAll() {
		return Collections.unmodifiableMap(new TreeMap<>(this.diagnostics));
	}

	public List<Diagnostic> get(String uri) {
		return this.diagnostics.getOrDefault(uri, List.of());
	}

	public void clear() {
		this.diagnostics.clear();
	}

}
