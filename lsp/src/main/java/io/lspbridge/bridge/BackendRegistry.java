/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.bridge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import io.lspbridge.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * 后端类型到{@link BackendPreset}的注册表。注册时校验名称：非空、小写、唯一。
 * 注册在启动阶段完成，之后只读。
 */
public class BackendRegistry {

	private static final Pattern KIND_PATTERN = Pattern.compile("[a-z][a-z0-9_-]*");

	private final Map<String, BackendPreset> presets = new LinkedHashMap<>();

	/**
	 * 注册一个后端。
	 * @param kind 后端类型
	 * @param preset 预设
	 * @return 注册表本身
	 * @throws IllegalArgumentException 如果名称无效或已注册
	 */
	public BackendRegistry register(String kind, BackendPreset preset) {
		Assert.hasText(kind, "Backend kind must not be empty");
		Assert.notNull(preset, "Backend preset must not be null");
		Assert.isTrue(KIND_PATTERN.matcher(kind).matches(), "Backend kind must be lower-case: " + kind);
		Assert.isTrue(!this.presets.containsKey(kind), "Backend kind already registered: " + kind);
		this.presets.put(kind, preset);
		return this;
	}

	@Nullable
	public BackendPreset get(String kind) {
		return kind != null ? this.presets.get(kind) : null;
	}

	public boolean contains(String kind) {
		return kind != null && this.presets.containsKey(kind);
	}

	/**
	 * 按注册顺序返回所有后端类型。
	 */
	public Set<String> kinds() {
		return Collections.unmodifiableSet(this.presets.keySet());
	}

}
