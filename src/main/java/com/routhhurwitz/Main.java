package com.routhhurwitz;

public class Main {

    public static void main(String[] args) {
        System.exit(new RouthDriver(System.out, System.err).run(args));
    }
}
