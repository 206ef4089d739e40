package com.example.tomograph;

import com.example.tomograph.algorithm.Tomograph;
import com.example.tomograph.service.PhantomCacheService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class TomographApplicationTests {

	@Autowired
	private Tomograph tomograph;

	@Autowired
	private PhantomCacheService phantomCacheService;

	@Test
	void contextLoads() {
		assertThat(tomograph).isNotNull();
		assertThat(phantomCacheService.phantomIds()).contains("point64", "ellipses64");
	}

}
