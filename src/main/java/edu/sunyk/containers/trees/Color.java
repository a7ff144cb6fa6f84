package edu.sunyk.containers.trees;

public enum Color {
    RED,
    BLACK
}
