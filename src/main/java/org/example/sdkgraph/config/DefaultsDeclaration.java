package org.example.sdkgraph.config;

/**
 * Declares member lists that several SDKs can inherit.
 */
public class DefaultsDeclaration extends MemberListDeclaration {
}
