package com.tony.auctionDraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuctionDraftApplication {

	public static void main(String[] args) {
		SpringApplication.run(AuctionDraftApplication.class, args);
	}

}
