package com.gomoku.tableservice.infrastructure.scheduler;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 事件投递线程池：每个参与者的出站队列占用一个长驻投递任务，与 STOMP 入站线程分开，
 * 某个连接写得慢不会拖住落子处理。
 */
@Configuration
public class EventDeliveryExecutorConfig {

	@Bean(name = "eventDeliveryExecutor", destroyMethod = "shutdownNow")
	public ExecutorService eventDeliveryExecutor() {
		return Executors.newCachedThreadPool(new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "event-delivery-" + idx.getAndIncrement());
				// 设置为守护线程
				t.setDaemon(true);
				return t;
			}
		});
	}
}
