/*
 * Copyright 2024-2024 原始作者保留所有权利。
 */

package io.lspbridge.util;

import java.net.URI;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * 杂项工具方法。
 *
 * @author Christian Tzolov
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * 检查给定的{@code String}是否包含实际的<em>文本</em>。
	 * <p>
	 * 更具体地说，如果{@code String}不为{@code null}，其长度大于0，
	 * 并且至少包含一个非空白字符，则此方法返回{@code true}。
	 * @param str 要检查的{@code String}（可能为{@code null}）
	 * @return 如果{@code String}不为{@code null}，其长度大于0，
	 * 且不仅包含空白字符，则返回{@code true}
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * 如果提供的Collection为{@code null}或为空，则返回{@code true}。
	 * @param collection 要检查的Collection
	 * @return 给定的Collection是否为空
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * 如果提供的Map为{@code null}或为空，则返回{@code true}。
	 * @param map 要检查的Map
	 * @return 给定的Map是否为空
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * 将{@code file://}形式的URI转换为本地路径。
	 * <ul>
	 * <li>带有{@code file}方案的绝对URI通过{@link Path#of(URI)}解析。</li>
	 * <li>其他字符串去掉可能存在的{@code file://}前缀后按普通路径处理。</li>
	 * </ul>
	 * @param uri 工作区根URI或路径
	 * @return 对应的本地路径
	 */
	public static Path toPath(String uri) {
		if (uri.startsWith("file:")) {
			try {
				return Path.of(URI.create(uri));
			}
			catch (IllegalArgumentException e) {
				return Path.of(uri.replaceFirst("^file://", ""));
			}
		}
		return Path.of(uri);
	}

}
