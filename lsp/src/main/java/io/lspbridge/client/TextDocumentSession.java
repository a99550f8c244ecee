/*
 * Copyright 2024-2024 the original author or authors.
 */

package io.lspbridge.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.lspbridge.spec.DocumentAlreadyOpenException;
import io.lspbridge.spec.DocumentNotOpenException;
import io.lspbridge.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * 客户端对已打开文档的本地记录。每个URI最多一条记录，打开时版本为1，每次变更加1。
 *
 * <p>
 * 同一URI上的并发变更不在此串行化，调用方需保证每个文档只有一个写入者。
 */
public class TextDocumentSession {

	/**
	 * 一个已打开文档的快照。
	 *
	 * @param uri 文档URI
	 * @param languageId 语言标识
	 * @param version 当前版本
	 * @param text 当前全文
	 */
	public record DocumentRecord(String uri, String languageId, int version, String text) {
	}

	private final ConcurrentHashMap<String, DocumentRecord> documents = new ConcurrentHashMap<>();

	/**
	 * 以版本1记录新打开的文档。
	 * @throws DocumentAlreadyOpenException 如果该URI已经打开，原有记录保持不变
	 */
	public DocumentRecord open(String uri, String languageId, String text) {
		Assert.hasText(uri, "The uri can not be empty");
		Assert.notNull(languageId, "The languageId can not be null");
		Assert.notNull(text, "The text can not be null");

		DocumentRecord record = new DocumentRecord(uri, languageId, 1, text);
		if (this.documents.putIfAbsent(uri, record) != null) {
			throw new DocumentAlreadyOpenException(uri);
		}
		return record;
	}

	/**
	 * 以全文替换文档内容并递增版本。
	 * @throws DocumentNotOpenException 如果该URI未打开
	 */
	public DocumentRecord change(String uri, String text) {
		Assert.notNull(text, "The text can not be null");
		DocumentRecord updated = uri != null ? this.documents.computeIfPresent(uri,
				(key, current) -> new DocumentRecord(key, current.languageId(), current.version() + 1, text)) : null;
		if (updated == null) {
			throw new DocumentNotOpenException(uri);
		}
		return updated;
	}

	/**
	 * 删除文档记录。
	 * @return 被删除的记录
	 * @throws DocumentNotOpenException 如果该URI未打开
	 */
	public DocumentRecord close(String uri) {
		DocumentRecord removed = uri != null ? this.documents.remove(uri) : null;
		if (removed == null) {
			throw new DocumentNotOpenException(uri);
		}
		return removed;
	}

	/**
	 * 撤销一次未送达的{@link #open}或{@link #change}：仅当当前记录仍是{@code applied}时，
	 * 恢复为{@code previous}（为{@code null}时删除记录）。记录已被清除或替换时不做任何事。
	 * @param applied 操作写入的记录
	 * @param previous 操作之前的记录，打开时为{@code null}
	 */
	public void revert(DocumentRecord applied, @Nullable DocumentRecord previous) {
		if (previous == null) {
			this.documents.remove(applied.uri(), applied);
		}
		else {
			this.documents.replace(applied.uri(), applied, previous);
		}
	}

	@Nullable
	public DocumentRecord get(String uri) {
		return uri != null ? this.documents.get(uri) : null;
	}

	public boolean isOpen(String uri) {
		return uri != null && this.documents.containsKey(uri);
	}

	/**
	 * 所有已打开文档的不可变快照。
	 */
	public Map<String, DocumentRecord> documents() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(this.documents));
	}

	/**
	 * 丢弃所有记录，不发送任何通知。用于连接拆除。
	 */
	public void clear() {
		this.documents.clear();
	}

}
