package io.github.huiyu.imgsort;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ImgSort {

    public static void main(String[] args) {
        SpringApplication.run(ImgSort.class, args);
    }
}
